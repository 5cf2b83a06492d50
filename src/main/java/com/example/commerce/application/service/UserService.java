package com.example.commerce.application.service;

import com.example.commerce.application.dto.CreateUserCommand;
import com.example.commerce.application.dto.OrderQuery;
import com.example.commerce.application.dto.OrderView;
import com.example.commerce.application.dto.PageQuery;
import com.example.commerce.application.dto.PageResult;
import com.example.commerce.application.dto.UpdateUserCommand;
import com.example.commerce.application.dto.UserQuery;
import com.example.commerce.application.dto.UserView;
import com.example.commerce.domain.exception.DuplicateResourceException;
import com.example.commerce.domain.exception.ForbiddenException;
import com.example.commerce.domain.exception.InvalidStateException;
import com.example.commerce.domain.exception.NotFoundException;
import com.example.commerce.domain.model.Actor;
import com.example.commerce.domain.model.Role;
import com.example.commerce.domain.model.UserStatus;
import com.example.commerce.infrastructure.persistence.entity.UserEntity;
import com.example.commerce.infrastructure.persistence.mapper.AccountPersistenceMapper;
import com.example.commerce.infrastructure.persistence.repository.OrderRepository;
import com.example.commerce.infrastructure.persistence.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;
import java.util.Set;

import static com.example.commerce.infrastructure.persistence.specification.UserSpecifications.hasRole;
import static com.example.commerce.infrastructure.persistence.specification.UserSpecifications.hasStatus;
import static com.example.commerce.infrastructure.persistence.specification.UserSpecifications.matches;

/**
 * User accounts. Credentials are handled by the upstream gateway; this service keeps
 * profiles, roles and the order aggregates.
 */
@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);
    private static final Set<String> SORTABLE = Set.of("createdAt", "name", "email", "totalOrders", "totalSpent");

    private final UserRepository userRepository;
    private final OrderRepository orderRepository;
    private final OrderService orderService;
    private final AccountPersistenceMapper mapper;

    public UserService(
            UserRepository userRepository,
            OrderRepository orderRepository,
            OrderService orderService,
            AccountPersistenceMapper mapper) {
        this.userRepository = userRepository;
        this.orderRepository = orderRepository;
        this.orderService = orderService;
        this.mapper = mapper;
    }

    @Transactional
    public UserView createUser(CreateUserCommand command, Actor actor) {
        actor.requireAnyRole(Role.ADMIN);
        String email = command.email().trim().toLowerCase(Locale.ROOT);
        if (userRepository.existsByEmailIgnoreCase(email)) {
            throw new DuplicateResourceException("email", "Email already registered");
        }

        UserEntity user = new UserEntity();
        user.setName(command.name());
        user.setEmail(email);
        user.setPhone(command.phone());
        user.setRole(command.role() != null ? command.role() : Role.CUSTOMER);
        user.setStatus(command.status() != null ? command.status() : UserStatus.ACTIVE);
        user.setAddress(command.address());
        user.setCity(command.city());
        user.setCountry(command.country());
        user.setPostalCode(command.postalCode());

        UserEntity saved = userRepository.save(user);
        log.info("User {} created with role {}", saved.getId(), saved.getRole());
        return mapper.toView(saved);
    }

    @Transactional(readOnly = true)
    public PageResult<UserView> listUsers(UserQuery query, Actor actor) {
        actor.requireAnyRole(Role.ADMIN, Role.MANAGER);
        Specification<UserEntity> spec = Specification.where(matches(query.search()))
                .and(hasRole(query.role()))
                .and(hasStatus(query.status()));
        return PageResult.from(userRepository.findAll(spec, query.page().toPageable(SORTABLE)), mapper::toView);
    }

    @Transactional(readOnly = true)
    public UserView getUser(String userId, Actor actor) {
        actor.requireOwnerOrElevated(userId);
        return mapper.toView(load(userId));
    }

    @Transactional
    public UserView updateUser(String userId, UpdateUserCommand command, Actor actor) {
        actor.requireOwnerOrElevated(userId);
        if ((command.status() != null || command.role() != null) && !actor.isAdmin()) {
            throw new ForbiddenException("Only administrators can change status or role");
        }
        UserEntity user = load(userId);

        if (command.name() != null) user.setName(command.name());
        if (command.phone() != null) user.setPhone(command.phone());
        if (command.address() != null) user.setAddress(command.address());
        if (command.city() != null) user.setCity(command.city());
        if (command.country() != null) user.setCountry(command.country());
        if (command.postalCode() != null) user.setPostalCode(command.postalCode());
        if (command.status() != null) user.setStatus(command.status());
        if (command.role() != null) user.setRole(command.role());

        return mapper.toView(user);
    }

    /**
     * @throws InvalidStateException when the user has placed orders
     */
    @Transactional
    public void deleteUser(String userId, Actor actor) {
        actor.requireAnyRole(Role.ADMIN);
        UserEntity user = load(userId);
        if (orderRepository.existsByUser_Id(userId)) {
            throw new InvalidStateException("Cannot delete a user with orders; deactivate the account instead");
        }
        userRepository.delete(user);
        log.info("User {} deleted by {}", userId, actor.userId());
    }

    @Transactional(readOnly = true)
    public PageResult<OrderView> userOrders(String userId, PageQuery page, Actor actor) {
        actor.requireOwnerOrElevated(userId);
        load(userId);
        return orderService.listOrders(new OrderQuery(null, null, null, null, userId, page), actor);
    }

    private UserEntity load(String userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("User", userId));
    }
}
