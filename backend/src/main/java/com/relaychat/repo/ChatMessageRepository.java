package com.relaychat.repo;

import com.relaychat.model.ChatMessage;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;

public interface ChatMessageRepository extends JpaRepository<ChatMessage, Long> {

    // Newest first; callers reverse for display
    @Query("""
           SELECT m FROM ChatMessage m
           ORDER BY m.date DESC, m.id DESC
           """)
    List<ChatMessage> findLatest(Pageable page);
}
