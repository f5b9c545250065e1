package com.wpanther.greengoods.repository;

import com.wpanther.greengoods.entity.UserAccount;
import com.wpanther.greengoods.entity.UserKey;
import com.wpanther.greengoods.entity.UserRole;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface UserAccountRepository extends JpaRepository<UserAccount, UserKey> {

    /**
     * Platform identity of the first user holding the given role whose joined garden matches
     */
    Optional<PlatformIdentity> findFirstByRoleAndCurrentGardenOrderByCreatedAtAsc(UserRole role, String currentGarden);
}
