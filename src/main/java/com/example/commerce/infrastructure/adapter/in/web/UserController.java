package com.example.commerce.infrastructure.adapter.in.web;

import com.example.commerce.application.dto.OrderView;
import com.example.commerce.application.dto.PageQuery;
import com.example.commerce.application.dto.PageResult;
import com.example.commerce.application.dto.UserQuery;
import com.example.commerce.application.dto.UserView;
import com.example.commerce.application.service.UserService;
import com.example.commerce.domain.model.Actor;
import com.example.commerce.domain.model.Role;
import com.example.commerce.domain.model.UserStatus;
import com.example.commerce.infrastructure.adapter.in.web.dto.ApiEnvelope;
import com.example.commerce.infrastructure.adapter.in.web.dto.CreateUserRequest;
import com.example.commerce.infrastructure.adapter.in.web.dto.UpdateUserRequest;
import com.example.commerce.infrastructure.adapter.in.web.mapper.CatalogWebMapper;
import com.example.commerce.infrastructure.adapter.in.web.support.Blocking;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/users")
@Tag(name = "Users", description = "User accounts")
public class UserController {

    private final UserService userService;
    private final CatalogWebMapper mapper;

    public UserController(UserService userService, CatalogWebMapper mapper) {
        this.userService = userService;
        this.mapper = mapper;
    }

    @Operation(summary = "Create a user", description = "ADMIN. 409 when the email is taken")
    @PostMapping
    public Mono<ResponseEntity<ApiEnvelope<UserView>>> createUser(Actor actor,
                                                                  @Valid @RequestBody CreateUserRequest request) {
        return Blocking.call(() -> userService.createUser(mapper.toCommand(request), actor))
                .map(user -> ResponseEntity.status(HttpStatus.CREATED)
                        .body(ApiEnvelope.ok(user, "User created successfully")));
    }

    @Operation(summary = "List users", description = "ADMIN or MANAGER")
    @GetMapping
    public Mono<ApiEnvelope<PageResult<UserView>>> listUsers(
            Actor actor,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) Role role,
            @RequestParam(required = false) UserStatus status,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) String sortBy,
            @RequestParam(required = false) String sortOrder) {
        UserQuery query = new UserQuery(search, role, status, PageQuery.of(page, limit, sortBy, sortOrder));
        return Blocking.call(() -> userService.listUsers(query, actor)).map(ApiEnvelope::ok);
    }

    @Operation(summary = "Get a user", description = "The user themselves or staff")
    @GetMapping("/{userId}")
    public Mono<ApiEnvelope<UserView>> getUser(Actor actor, @PathVariable String userId) {
        return Blocking.call(() -> userService.getUser(userId, actor)).map(ApiEnvelope::ok);
    }

    @Operation(summary = "Update a user", description = "Status and role changes are reserved to ADMIN")
    @PutMapping("/{userId}")
    public Mono<ApiEnvelope<UserView>> updateUser(Actor actor, @PathVariable String userId,
                                                  @Valid @RequestBody UpdateUserRequest request) {
        return Blocking.call(() -> userService.updateUser(userId, mapper.toCommand(request), actor))
                .map(user -> ApiEnvelope.ok(user, "User updated successfully"));
    }

    @Operation(summary = "Delete a user", description = "ADMIN. Refused once the user has orders")
    @DeleteMapping("/{userId}")
    public Mono<ApiEnvelope<Void>> deleteUser(Actor actor, @PathVariable String userId) {
        return Blocking.run(() -> userService.deleteUser(userId, actor))
                .thenReturn(ApiEnvelope.message("User deleted successfully"));
    }

    @Operation(summary = "Orders of a user")
    @GetMapping("/{userId}/orders")
    public Mono<ApiEnvelope<PageResult<OrderView>>> userOrders(
            Actor actor,
            @PathVariable String userId,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        return Blocking.call(() -> userService.userOrders(userId, PageQuery.of(page, limit), actor))
                .map(ApiEnvelope::ok);
    }
}
