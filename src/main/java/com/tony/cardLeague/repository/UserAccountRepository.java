package com.tony.cardLeague.repository;

import com.tony.cardLeague.model.UserAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserAccountRepository extends JpaRepository<UserAccount, Long> {

    // Crédit atomique côté base (lecture-modification-écriture en une requête)
    @Modifying(flushAutomatically = true)
    @Query("UPDATE UserAccount u SET u.coins = u.coins + :amount WHERE u.id = :userId")
    int creditCoins(@Param("userId") Long userId, @Param("amount") int amount);
}
