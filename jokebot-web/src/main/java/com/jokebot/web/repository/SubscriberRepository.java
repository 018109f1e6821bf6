package com.jokebot.web.repository;

import com.jokebot.web.entity.SubscriberEntity;
import org.springframework.data.jdbc.repository.query.Query;
import org.springframework.data.repository.CrudRepository;

import java.util.List;
import java.util.Optional;

public interface SubscriberRepository extends CrudRepository<SubscriberEntity, Long> {

    Optional<SubscriberEntity> findByChatId(String chatId);

    @Query("SELECT * FROM t_subscriber WHERE enabled = 1 ORDER BY id")
    List<SubscriberEntity> findAllEnabled();

    @Query("SELECT COUNT(*) FROM t_subscriber WHERE enabled = 1")
    long countEnabled();
}
