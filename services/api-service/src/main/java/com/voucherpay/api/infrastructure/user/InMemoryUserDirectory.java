package com.voucherpay.api.infrastructure.user;

import com.voucherpay.api.domain.UserDirectory;
import com.voucherpay.api.domain.UserRecord;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.UnaryOperator;
import org.springframework.stereotype.Component;

/**
 * {@link UserDirectory} kept in memory; the default until a persistent store is wired.
 */
@Component
public class InMemoryUserDirectory implements UserDirectory {

    private final ConcurrentMap<String, UserRecord> usersById = new ConcurrentHashMap<>();

    /** Adds or replaces a user. */
    public void save(UserRecord user) {
        usersById.put(user.id(), user);
    }

    @Override
    public Optional<UserRecord> findByIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return Optional.empty();
        }
        UserRecord byId = usersById.get(identifier);
        if (byId != null) {
            return Optional.of(byId);
        }
        String needle = identifier.strip().toLowerCase(Locale.ROOT);
        return usersById.values().stream()
                .filter(u -> matches(u.email(), needle) || matches(u.username(), needle))
                .findFirst();
    }

    @Override
    public void updatePasswordHash(String userId, String passwordHash) {
        replace(userId, user -> user.withPasswordHash(passwordHash));
    }

    @Override
    public void activateTwoFactor(String userId, String totpSecret) {
        replace(userId, user -> user.withTwoFactor(totpSecret));
    }

    private void replace(String userId, UnaryOperator<UserRecord> change) {
        if (usersById.computeIfPresent(userId, (id, user) -> change.apply(user)) == null) {
            throw new NoSuchElementException("No user with id " + userId);
        }
    }

    private static boolean matches(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).equals(needle);
    }
}
