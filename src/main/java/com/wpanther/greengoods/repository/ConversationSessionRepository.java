package com.wpanther.greengoods.repository;

import com.wpanther.greengoods.entity.ConversationSession;
import com.wpanther.greengoods.entity.UserKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ConversationSessionRepository extends JpaRepository<ConversationSession, UserKey> {
}
