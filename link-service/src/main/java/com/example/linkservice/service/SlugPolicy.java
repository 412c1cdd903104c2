package com.example.linkservice.service;

import com.example.linkservice.exception.InvalidSlugException;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Slug rules: random generation, custom slug normalization and reserved paths.
 */
@Component
public class SlugPolicy {

    // No 0/O or l/I, they read alike on printed links
    static final String ALPHABET = "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghjkmnpqrstuvwxyz";
    static final int GENERATED_LENGTH = 6;
    static final int MAX_LENGTH = 50;
    static final int MAX_GENERATION_ATTEMPTS = 3;

    private static final Pattern VALID_SLUG = Pattern.compile("^[a-zA-Z0-9_-]+$");

    private static final List<String> RESERVED_PATHS = List.of(
            "login", "logout", "auth", "callback", "dashboard", "api", "admin",
            "_next", "static", "favicon.ico", "robots.txt", "sitemap.xml", "internal", "actuator");

    private final SecureRandom random = new SecureRandom();

    public String generate() {
        StringBuilder slug = new StringBuilder(GENERATED_LENGTH);
        for (int i = 0; i < GENERATED_LENGTH; i++) {
            slug.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return slug.toString();
    }

    /**
     * Generate a slug not yet taken.
     *
     * @throws IllegalStateException if every attempt collided
     */
    public String generateUnique(Predicate<String> exists) {
        for (int attempt = 0; attempt < MAX_GENERATION_ATTEMPTS; attempt++) {
            String slug = generate();
            if (isValid(slug) && !exists.test(slug)) {
                return slug;
            }
        }
        throw new IllegalStateException("Failed to generate unique slug after " + MAX_GENERATION_ATTEMPTS + " attempts");
    }

    /**
     * Trim and lowercase a user-supplied slug.
     *
     * @throws InvalidSlugException if the result is empty, too long, malformed or reserved
     */
    public String normalize(String customSlug) {
        String slug = customSlug.trim().toLowerCase(Locale.ROOT);
        if (!isValid(slug)) {
            throw new InvalidSlugException(customSlug);
        }
        return slug;
    }

    public boolean isValid(String slug) {
        if (slug == null || slug.isEmpty() || slug.length() > MAX_LENGTH) {
            return false;
        }
        return VALID_SLUG.matcher(slug).matches() && !isReserved(slug);
    }

    static boolean isReserved(String slug) {
        return RESERVED_PATHS.contains(slug.toLowerCase(Locale.ROOT));
    }
}
