package com.flagship.escrow_engine.transaction;

import org.springframework.data.jpa.domain.Specification;

import java.util.UUID;

/**
 * Specifications for listing a party's sales.
 */
final class TransactionQueries {

    private TransactionQueries() {
    }

    static Specification<EscrowTransactionEntity> forParty(UUID partyId, PartyRole role) {
        return switch (role) {
            case BUYER -> (root, query, cb) -> cb.equal(root.get("buyerId"), partyId);
            case SELLER -> (root, query, cb) -> cb.equal(root.get("sellerId"), partyId);
            case ANY -> (root, query, cb) -> cb.or(
                cb.equal(root.get("buyerId"), partyId),
                cb.equal(root.get("sellerId"), partyId));
        };
    }

    static Specification<EscrowTransactionEntity> withStatus(TransactionStatus status) {
        return (root, query, cb) -> status == null ? cb.conjunction() : cb.equal(root.get("status"), status);
    }
}
