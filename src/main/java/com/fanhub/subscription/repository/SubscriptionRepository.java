package com.fanhub.subscription.repository;

import com.fanhub.subscription.domain.model.Subscription;
import com.fanhub.subscription.domain.model.Subscription.SubscriptionState;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.data.repository.query.Param;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Data access for one subscription table.
 * Every query names the state it expects; deleted rows are never filtered implicitly.
 *
 * @param <T> Concrete subscription entity
 * @author FanHub Team
 */
@NoRepositoryBean
public interface SubscriptionRepository<T extends Subscription> extends JpaRepository<T, String> {

    /**
     * Find the row for a pair regardless of state.
     *
     * @param userId User ID
     * @param targetId Target ID
     * @return Optional containing the row if present
     */
    Optional<T> findByUserIdAndTargetId(String userId, String targetId);

    Optional<T> findByUserIdAndTargetIdAndState(String userId, String targetId, SubscriptionState state);

    /**
     * Find the row for a pair with a pessimistic write lock.
     * Serializes concurrent subscribe/unsubscribe calls on the same pair until the transaction ends.
     *
     * @param userId User ID
     * @param targetId Target ID
     * @return Optional containing the locked row if present
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM #{#entityName} s WHERE s.userId = :userId AND s.targetId = :targetId")
    Optional<T> findForUpdate(@Param("userId") String userId, @Param("targetId") String targetId);

    long countByTargetIdAndState(String targetId, SubscriptionState state);

    List<T> findByUserIdAndStateOrderByUpdatedAtDesc(String userId, SubscriptionState state);

    /**
     * Ids of deleted rows whose deletion is at or before the cutoff, oldest first.
     *
     * @param state Always DELETED; passed as a parameter to keep the query portable
     * @param cutoff Retention cutoff
     * @param pageable Batch size
     * @return Candidate ids
     */
    @Query("SELECT s.subscriptionId FROM #{#entityName} s " +
           "WHERE s.state = :state AND s.deletedAt <= :cutoff ORDER BY s.deletedAt")
    List<String> findIdsByStateAndDeletedAtBefore(
            @Param("state") SubscriptionState state,
            @Param("cutoff") Instant cutoff,
            Pageable pageable
    );

    /**
     * Hard delete the given rows. The predicate is re-checked so a row restored
     * after it was selected is left alone.
     *
     * @param ids Candidate ids
     * @param state Always DELETED
     * @param cutoff Retention cutoff
     * @return Number of rows deleted
     */
    @Modifying
    @Query("DELETE FROM #{#entityName} s " +
           "WHERE s.subscriptionId IN :ids AND s.state = :state AND s.deletedAt <= :cutoff")
    int deleteByIdsAndStateAndDeletedAtBefore(
            @Param("ids") Collection<String> ids,
            @Param("state") SubscriptionState state,
            @Param("cutoff") Instant cutoff
    );

    default Optional<T> findAny(String userId, String targetId) {
        return findByUserIdAndTargetId(userId, targetId);
    }

    default Optional<T> findActive(String userId, String targetId) {
        return findByUserIdAndTargetIdAndState(userId, targetId, SubscriptionState.ACTIVE);
    }

    default Optional<T> findDeleted(String userId, String targetId) {
        return findByUserIdAndTargetIdAndState(userId, targetId, SubscriptionState.DELETED);
    }

    default long countActive(String targetId) {
        return countByTargetIdAndState(targetId, SubscriptionState.ACTIVE);
    }

    /**
     * Active subscriptions of a user, most recently (re)activated first.
     */
    default List<T> findActiveByUserId(String userId) {
        return findByUserIdAndStateOrderByUpdatedAtDesc(userId, SubscriptionState.ACTIVE);
    }

    default List<String> findPurgeCandidateIds(Instant cutoff, Pageable pageable) {
        return findIdsByStateAndDeletedAtBefore(SubscriptionState.DELETED, cutoff, pageable);
    }

    default int purgeDeleted(Collection<String> ids, Instant cutoff) {
        return deleteByIdsAndStateAndDeletedAtBefore(ids, SubscriptionState.DELETED, cutoff);
    }
}
