package com.wpanther.greengoods.port;

import com.wpanther.greengoods.dto.BotUser;
import com.wpanther.greengoods.dto.CreateUserRequest;
import com.wpanther.greengoods.dto.SessionUpdate;
import com.wpanther.greengoods.dto.UserUpdate;
import com.wpanther.greengoods.entity.ConversationSession;
import com.wpanther.greengoods.entity.PendingWork;
import com.wpanther.greengoods.entity.Platform;
import com.wpanther.greengoods.entity.UserKey;

import java.util.List;
import java.util.Optional;

/**
 * Durable users, sessions and pending work.
 */
public interface StoragePort {

    /**
     * Loads a user with the custodial key decrypted. A legacy plaintext key is re-encrypted on the way.
     */
    Optional<BotUser> getUser(Platform platform, String platformId);

    BotUser createUser(CreateUserRequest request);

    void updateUser(Platform platform, String platformId, UserUpdate update);

    /**
     * Platform identity of the first operator whose joined garden is the given one, if any.
     * The operator's key is not loaded.
     */
    Optional<UserKey> getOperatorForGarden(String gardenAddress);

    /**
     * Empty means idle with no draft.
     */
    Optional<ConversationSession> getSession(Platform platform, String platformId);

    void setSession(Platform platform, String platformId, SessionUpdate update);

    void clearSession(Platform platform, String platformId);

    void addPendingWork(PendingWork work);

    Optional<PendingWork> getPendingWork(String id);

    /**
     * Pending work of one garden, most recent first.
     */
    List<PendingWork> getPendingWorksForGarden(String gardenAddress);

    /**
     * @return true when a record was removed, false when it was already gone
     */
    boolean removePendingWork(String id);

    boolean pendingWorkExists(String id);

    void close();
}
