package com.pickem.bet.repository;

import com.pickem.bet.entity.UserAccount;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface UserAccountRepository extends JpaRepository<UserAccount, String> {

    /**
     * Row-locks the account for the rest of the transaction. Concurrent deltas
     * against the same user queue here; the wait is bounded by
     * {@code jakarta.persistence.lock.timeout}.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM UserAccount a WHERE a.userId = :userId")
    Optional<UserAccount> findByIdForUpdate(@Param("userId") String userId);

    @Query("SELECT a.userId FROM UserAccount a ORDER BY a.userId")
    List<String> findAllUserIds();
}
