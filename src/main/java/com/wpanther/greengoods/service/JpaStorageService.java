package com.wpanther.greengoods.service;

import com.wpanther.greengoods.dto.BotUser;
import com.wpanther.greengoods.dto.CreateUserRequest;
import com.wpanther.greengoods.dto.KeyMigrationResult;
import com.wpanther.greengoods.dto.SessionUpdate;
import com.wpanther.greengoods.dto.UserUpdate;
import com.wpanther.greengoods.entity.ConversationSession;
import com.wpanther.greengoods.entity.PendingWork;
import com.wpanther.greengoods.entity.Platform;
import com.wpanther.greengoods.entity.UserAccount;
import com.wpanther.greengoods.entity.UserKey;
import com.wpanther.greengoods.entity.UserRole;
import com.wpanther.greengoods.exception.InvalidKeyMaterialException;
import com.wpanther.greengoods.port.StoragePort;
import com.wpanther.greengoods.repository.ConversationSessionRepository;
import com.wpanther.greengoods.repository.PendingWorkRepository;
import com.wpanther.greengoods.repository.UserAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage port on Spring Data JPA. Custodial keys only ever reach the database as vault envelopes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaStorageService implements StoragePort {

    private final UserAccountRepository userAccountRepository;
    private final ConversationSessionRepository sessionRepository;
    private final PendingWorkRepository pendingWorkRepository;
    private final CredentialVault credentialVault;
    private final CustodialWalletService walletService;
    private final Clock clock;

    @Override
    @Transactional
    public Optional<BotUser> getUser(Platform platform, String platformId) {
        return userAccountRepository.findById(new UserKey(platform, platformId))
                .map(this::toBotUser);
    }

    @Override
    @Transactional
    public BotUser createUser(CreateUserRequest request) {
        if (!walletService.isValidPrivateKey(request.getPrivateKey())) {
            throw new InvalidKeyMaterialException("Invalid private key format: expected 0x followed by 64 hex characters");
        }
        if (!walletService.isValidAddress(request.getAddress())) {
            throw new InvalidKeyMaterialException("Invalid address format: expected 0x followed by 40 hex characters");
        }
        UserKey key = new UserKey(request.getPlatform(), request.getPlatformId());
        if (userAccountRepository.existsById(key)) {
            throw new IllegalStateException("User already exists: " + request.getPlatform().getCode()
                    + ":" + request.getPlatformId());
        }

        UserAccount account = UserAccount.builder()
                .platform(request.getPlatform())
                .platformId(request.getPlatformId())
                .encryptedPrivateKey(credentialVault.encrypt(request.getPrivateKey()))
                .address(request.getAddress())
                .role(UserRole.GARDENER)
                .createdAt(Instant.now(clock))
                .build();
        userAccountRepository.save(account);

        log.info("Created user: platform={}, platformId={}, address={}",
                account.getPlatform().getCode(), account.getPlatformId(), account.getAddress());

        return toBotUser(account, request.getPrivateKey());
    }

    @Override
    @Transactional
    public void updateUser(Platform platform, String platformId, UserUpdate update) {
        UserAccount account = userAccountRepository.findById(new UserKey(platform, platformId))
                .orElseThrow(() -> new IllegalArgumentException("User not found: " + platform.getCode() + ":" + platformId));

        if (update.getCurrentGarden() != null) {
            if (!walletService.isValidAddress(update.getCurrentGarden())) {
                throw new InvalidKeyMaterialException("Invalid garden address format");
            }
            account.setCurrentGarden(update.getCurrentGarden());
        }
        if (update.getRole() != null) {
            account.setRole(update.getRole());
        }
        userAccountRepository.save(account);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<UserKey> getOperatorForGarden(String gardenAddress) {
        return userAccountRepository
                .findFirstByRoleAndCurrentGardenOrderByCreatedAtAsc(UserRole.OPERATOR, gardenAddress)
                .map(identity -> new UserKey(identity.getPlatform(), identity.getPlatformId()));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ConversationSession> getSession(Platform platform, String platformId) {
        return sessionRepository.findById(new UserKey(platform, platformId));
    }

    @Override
    @Transactional
    public void setSession(Platform platform, String platformId, SessionUpdate update) {
        ConversationSession session = sessionRepository.findById(new UserKey(platform, platformId))
                .orElseGet(() -> ConversationSession.builder()
                        .platform(platform)
                        .platformId(platformId)
                        .build());
        session.setStep(update.getStep());
        session.setDraft(update.getDraft());
        session.setUpdatedAt(Instant.now(clock));
        sessionRepository.save(session);

        log.debug("Session set: platform={}, platformId={}, step={}",
                platform.getCode(), platformId, update.getStep().getCode());
    }

    @Override
    @Transactional
    public void clearSession(Platform platform, String platformId) {
        UserKey key = new UserKey(platform, platformId);
        if (sessionRepository.existsById(key)) {
            sessionRepository.deleteById(key);
            log.debug("Session cleared: platform={}, platformId={}", platform.getCode(), platformId);
        }
    }

    @Override
    @Transactional
    public void addPendingWork(PendingWork work) {
        if (work.getCreatedAt() == null) {
            work.setCreatedAt(Instant.now(clock));
        }
        pendingWorkRepository.save(work);
        log.info("Pending work added: id={}, garden={}, gardener={}",
                work.getId(), work.getGardenAddress(), work.getGardenerAddress());
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<PendingWork> getPendingWork(String id) {
        return pendingWorkRepository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public List<PendingWork> getPendingWorksForGarden(String gardenAddress) {
        return pendingWorkRepository.findByGardenAddressOrderByCreatedAtDescIdDesc(gardenAddress);
    }

    @Override
    @Transactional
    public boolean removePendingWork(String id) {
        boolean removed = pendingWorkRepository.deleteByIdReturningCount(id) > 0;
        log.info("Pending work removal: id={}, removed={}", id, removed);
        return removed;
    }

    @Override
    @Transactional(readOnly = true)
    public boolean pendingWorkExists(String id) {
        return pendingWorkRepository.existsById(id);
    }

    @Override
    public void close() {
        // Connections belong to the Spring-managed DataSource
        log.info("Storage close requested; datasource lifecycle is container managed");
    }

    private BotUser toBotUser(UserAccount account) {
        KeyMigrationResult key = credentialVault.migrateIfNeeded(account.getEncryptedPrivateKey());
        if (key.isNeedsMigration()) {
            // Concurrent migrations of one row both write a valid envelope of the same key
            account.setEncryptedPrivateKey(credentialVault.encrypt(key.getPlaintext()));
            userAccountRepository.save(account);
            log.info("Migrated legacy plaintext key to encrypted envelope: platform={}, platformId={}",
                    account.getPlatform().getCode(), account.getPlatformId());
        }
        return toBotUser(account, key.getPlaintext());
    }

    private BotUser toBotUser(UserAccount account, String privateKey) {
        return BotUser.builder()
                .platform(account.getPlatform())
                .platformId(account.getPlatformId())
                .privateKey(privateKey)
                .address(account.getAddress())
                .currentGarden(account.getCurrentGarden())
                .role(account.getRole())
                .createdAt(account.getCreatedAt())
                .build();
    }
}
