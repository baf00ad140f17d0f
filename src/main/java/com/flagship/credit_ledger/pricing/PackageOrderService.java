package com.flagship.credit_ledger.pricing;

import com.flagship.credit_ledger.ledger.Asset;
import com.flagship.credit_ledger.ledger.LedgerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Package orders: open a quoted purchase, then complete it once a deposit
 * leaves enough funds. An account has at most one open order; opening a new
 * one cancels the previous.
 */
@Service
@Slf4j
public class PackageOrderService {

    private final PackageOrderRepository orderRepository;
    private final PackagePurchaseService purchaseService;
    private final LedgerService ledgerService;
    private final Duration ttl;

    public PackageOrderService(PackageOrderRepository orderRepository,
                               PackagePurchaseService purchaseService,
                               LedgerService ledgerService,
                               @Value("${package-order.ttl:PT30M}") Duration ttl) {
        this.orderRepository = orderRepository;
        this.purchaseService = purchaseService;
        this.ledgerService = ledgerService;
        this.ttl = ttl;
    }

    @Transactional
    public PackageOrder open(UUID accountId, String packageId, CatalogSnapshot snapshot) {
        PackagePrice price = snapshot.price(packageId);

        for (PackageOrderEntity previous : orderRepository.findByAccountIdAndStatusForUpdate(accountId, PackageOrderStatus.OPEN)) {
            previous.updateFromDomain(previous.toDomain().cancel());
            orderRepository.save(previous);
            log.info("Package order superseded: orderId={}, accountId={}", previous.getId(), accountId);
        }

        BigDecimal funds = ledgerService.balance(accountId, Asset.FUNDS);
        PackageOrder order = PackageOrder.open(accountId, price, snapshot.getVersion(), funds, ttl);
        orderRepository.save(PackageOrderEntity.fromDomain(order));

        log.info("Package order opened: orderId={}, accountId={}, packageId={}, cost={}, requiredPayment={}, expiresAt={}",
                order.getId(), accountId, packageId, order.getCost(), order.getRequiredPayment(), order.getExpiresAt());
        return order;
    }

    @Transactional(readOnly = true)
    public Optional<PackageOrder> findOpen(UUID accountId) {
        Instant now = Instant.now();
        return orderRepository.findByAccountIdAndStatusOrderByCreatedAtDesc(accountId, PackageOrderStatus.OPEN)
            .stream()
            .map(PackageOrderEntity::toDomain)
            .filter(order -> !order.isExpired(now))
            .findFirst();
    }

    /**
     * Payment a deposit should carry to cover the account's open order, if it has one.
     */
    @Transactional(readOnly = true)
    public Optional<BigDecimal> requiredPaymentFor(UUID accountId) {
        return findOpen(accountId).map(PackageOrder::getRequiredPayment);
    }

    /**
     * Completes the account's open order if its funds now cover the quoted cost.
     *
     * @return the purchase made, or empty if there was no open order or funds are still short
     */
    @Transactional
    public Optional<PackagePurchase> completeIfFunded(UUID accountId) {
        List<PackageOrderEntity> open = orderRepository.findByAccountIdAndStatusForUpdate(accountId, PackageOrderStatus.OPEN);
        if (open.isEmpty()) {
            return Optional.empty();
        }

        PackageOrderEntity entity = open.get(0);
        PackageOrder order = entity.toDomain();
        if (order.isExpired(Instant.now())) {
            entity.updateFromDomain(order.expire());
            orderRepository.save(entity);
            log.info("Package order expired before funding: orderId={}, accountId={}", order.getId(), accountId);
            return Optional.empty();
        }

        BigDecimal funds = ledgerService.balance(accountId, Asset.FUNDS);
        if (funds.compareTo(order.getCost()) < 0) {
            log.info("Package order still short of funds: orderId={}, accountId={}, funds={}, cost={}",
                    order.getId(), accountId, funds, order.getCost());
            return Optional.empty();
        }

        PackagePurchase purchase = purchaseService.purchase(order.getId(), accountId, order.getPackageId(),
            order.getUnitCount(), order.getCost(), order.getCatalogVersion());
        entity.updateFromDomain(order.complete(purchase.getId()));
        orderRepository.save(entity);

        log.info("Package order completed: orderId={}, accountId={}, purchaseId={}",
                order.getId(), accountId, purchase.getId());
        return Optional.of(purchase);
    }

    /**
     * @return number of orders moved to EXPIRED
     */
    @Transactional
    public int expireStale(int limit) {
        List<PackageOrderEntity> stale = orderRepository.findExpiring(PackageOrderStatus.OPEN, Instant.now(),
            PageRequest.of(0, limit));
        for (PackageOrderEntity entity : stale) {
            entity.updateFromDomain(entity.toDomain().expire());
            orderRepository.save(entity);
        }
        if (!stale.isEmpty()) {
            log.info("Expired {} package orders", stale.size());
        }
        return stale.size();
    }
}
