package com.example.commerce.application.service;

import com.example.commerce.application.dto.NotificationPage;
import com.example.commerce.application.dto.NotificationView;
import com.example.commerce.application.dto.PageQuery;
import com.example.commerce.application.dto.PageResult;
import com.example.commerce.domain.exception.ForbiddenException;
import com.example.commerce.domain.exception.NotFoundException;
import com.example.commerce.domain.model.Actor;
import com.example.commerce.domain.model.NotificationType;
import com.example.commerce.infrastructure.persistence.entity.NotificationEntity;
import com.example.commerce.infrastructure.persistence.mapper.AccountPersistenceMapper;
import com.example.commerce.infrastructure.persistence.repository.NotificationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

/**
 * Per-user notification inbox. Notifications are written inside the transaction of
 * the event that caused them.
 */
@Service
public class NotificationService {

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final NotificationRepository notificationRepository;
    private final AccountPersistenceMapper mapper;

    public NotificationService(NotificationRepository notificationRepository, AccountPersistenceMapper mapper) {
        this.notificationRepository = notificationRepository;
        this.mapper = mapper;
    }

    @Transactional
    public void notify(String userId, NotificationType type, String title, String message, String link) {
        notificationRepository.save(NotificationEntity.of(userId, type, title, message, link));
        log.debug("Notification {} queued for user {}", type, userId);
    }

    @Transactional(readOnly = true)
    public NotificationPage list(Actor actor, boolean unreadOnly, PageQuery pageQuery) {
        Pageable pageable = pageQuery.toPageable(Sort.unsorted());
        Page<NotificationEntity> page = unreadOnly
                ? notificationRepository.findByUserIdAndReadFalseOrderByCreatedAtDesc(actor.userId(), pageable)
                : notificationRepository.findByUserIdOrderByCreatedAtDesc(actor.userId(), pageable);

        PageResult<NotificationView> result = PageResult.from(page, mapper::toView);
        return new NotificationPage(result.items(), result.pagination(),
                notificationRepository.countByUserIdAndReadFalse(actor.userId()));
    }

    @Transactional(readOnly = true)
    public NotificationView get(String id, Actor actor) {
        return mapper.toView(loadOwned(id, actor));
    }

    @Transactional
    public NotificationView markRead(String id, Actor actor) {
        NotificationEntity notification = loadOwned(id, actor);
        notification.markRead();
        return mapper.toView(notification);
    }

    /**
     * @return number of notifications that changed to read
     */
    @Transactional
    public int markAllRead(Actor actor) {
        int updated = notificationRepository.markAllRead(actor.userId(), Instant.now());
        log.debug("Marked {} notification(s) read for user {}", updated, actor.userId());
        return updated;
    }

    @Transactional
    public void delete(String id, Actor actor) {
        notificationRepository.delete(loadOwned(id, actor));
    }

    private NotificationEntity loadOwned(String id, Actor actor) {
        NotificationEntity notification = notificationRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Notification", id));
        if (!notification.getUserId().equals(actor.userId())) {
            throw new ForbiddenException("Access denied");
        }
        return notification;
    }
}
