package com.rumbl.service;

import com.rumbl.model.User;
import com.rumbl.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

@Service
public class AccountService {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private static final Set<String> FIELDS = Set.of("id", "name", "username");

    private final UserRepository userRepository;

    public AccountService(UserRepository userRepository) {
        this.userRepository = userRepository;
    }

    /**
     * All users, in seed order.
     */
    public List<User> list() {
        return userRepository.findAll();
    }

    /**
     * Find a user by id.
     *
     * @param id the user id, e.g. "1"
     * @return the user, or empty if no user has that id
     */
    public Optional<User> get(String id) {
        Optional<User> user = list().stream()
            .filter(u -> Objects.equals(u.id(), id))
            .findFirst();
        if (user.isEmpty()) {
            log.debug("No user with id {}", id);
        }
        return user;
    }

    public User getOrThrow(String id) {
        return get(id).orElseThrow(() -> new UserNotFoundException(id));
    }

    /**
     * Find the first user matching every criterion.
     * Keys are field names (id, name, username); an empty map matches the first user.
     *
     * @param criteria field name to expected value
     * @return the first matching user, or empty if none matches
     * @throws IllegalArgumentException if a key is not a user field
     */
    public Optional<User> getBy(Map<String, String> criteria) {
        criteria.keySet().forEach(AccountService::requireField);

        Optional<User> user = list().stream()
            .filter(u -> criteria.entrySet().stream()
                .allMatch(c -> Objects.equals(fieldValue(u, c.getKey()), c.getValue())))
            .findFirst();
        if (user.isEmpty()) {
            log.debug("No user matching {}", criteria);
        }
        return user;
    }

    private static void requireField(String field) {
        if (field == null || !FIELDS.contains(field)) {
            throw new IllegalArgumentException("Unknown user field: " + field);
        }
    }

    private static String fieldValue(User user, String field) {
        return switch (field) {
            case "id" -> user.id();
            case "name" -> user.name();
            case "username" -> user.username();
            default -> throw new IllegalArgumentException("Unknown user field: " + field);
        };
    }
}
