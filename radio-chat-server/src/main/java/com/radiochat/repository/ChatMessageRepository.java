package com.radiochat.repository;

import com.radiochat.model.ChatMessage;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ChatMessageRepository extends JpaRepository<ChatMessage, String>, ChatMessageRepositoryCustom {
}
