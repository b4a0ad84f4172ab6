package com.tradestore.repository.jpa;

import com.tradestore.entity.AccountEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the accounts table.
 * Ids are caller-assigned, so existence is checked before insert to tell a duplicate
 * from an update.
 */
@Repository
public interface AccountJpaRepository extends JpaRepository<AccountEntity, Long> {

    List<AccountEntity> findAllByOrderByAccountIdAsc();
}
