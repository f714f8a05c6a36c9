package com.openforge.alchemy.settings;

import com.openforge.alchemy.domain.StoreConfigEntry;
import com.openforge.alchemy.repository.StoreConfigEntryRepository;
import com.openforge.alchemy.store.StoreException;
import com.openforge.alchemy.store.StoreProperties;
import com.openforge.alchemy.store.StoreTransactions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Persisted key/value policy table.
 *
 * Reads never fail on content: an absent key or a value that does not parse
 * as the requested type yields the caller's default. Typed getters trim the
 * stored text before parsing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StoreConfigService {

    private final StoreConfigEntryRepository repository;
    private final StoreTransactions          transactions;

    // ── Typed reads ──────────────────────────────────────────────────────────

    public Optional<String> find(String key) {
        return transactions.read("config.get", () -> repository.findById(key).map(StoreConfigEntry::getValue));
    }

    public String getString(String key, String defaultValue) {
        return find(key).orElse(defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        return find(key).map(v -> {
            try {
                return Integer.parseInt(v.trim());
            } catch (NumberFormatException e) {
                log.warn("[Config] '{}' is not an integer ({}), using default {}", key, v, defaultValue);
                return defaultValue;
            }
        }).orElse(defaultValue);
    }

    public double getFloat(String key, double defaultValue) {
        return find(key).map(v -> {
            try {
                double d = Double.parseDouble(v.trim());
                return Double.isFinite(d) ? d : defaultValue;
            } catch (NumberFormatException e) {
                log.warn("[Config] '{}' is not a number ({}), using default {}", key, v, defaultValue);
                return defaultValue;
            }
        }).orElse(defaultValue);
    }

    /** Accepts true/false, yes/no, on/off and 1/0 in any case. */
    public boolean getBool(String key, boolean defaultValue) {
        return find(key).map(v -> switch (v.trim().toLowerCase()) {
            case "true", "yes", "on", "1"  -> true;
            case "false", "no", "off", "0" -> false;
            default -> {
                log.warn("[Config] '{}' is not a boolean ({}), using default {}", key, v, defaultValue);
                yield defaultValue;
            }
        }).orElse(defaultValue);
    }

    /** Every stored entry, sorted by key. */
    public Map<String, String> all() {
        return transactions.read("config.all", () -> {
            Map<String, String> out = new TreeMap<>();
            repository.findAll().forEach(e -> out.put(e.getKey(), e.getValue()));
            return out;
        });
    }

    // ── Writes ───────────────────────────────────────────────────────────────

    public void set(String key, String value) {
        requireKey(key);
        if (value == null) throw StoreException.invalid("config value must not be null: " + key);
        transactions.execute("config.set", () -> {
            StoreConfigEntry entry = repository.findById(key).orElseGet(() -> new StoreConfigEntry(key, value));
            entry.setValue(value);
            repository.save(entry);
        });
        log.info("[Config] {} = {}", key, value);
    }

    /** @return true when the key was absent and has been written */
    public boolean setIfAbsent(String key, String value) {
        requireKey(key);
        if (value == null) throw StoreException.invalid("config value must not be null: " + key);
        return transactions.write("config.setIfAbsent", () -> {
            if (repository.existsById(key)) return false;
            repository.save(new StoreConfigEntry(key, value));
            return true;
        });
    }

    /** @return true when an entry was removed */
    public boolean remove(String key) {
        requireKey(key);
        boolean removed = transactions.write("config.remove", () -> {
            if (!repository.existsById(key)) return false;
            repository.deleteById(key);
            return true;
        });
        if (removed) log.info("[Config] Removed {}", key);
        return removed;
    }

    /**
     * Writes every lifecycle default that is not stored yet.
     * Existing values are left alone, so edits made at runtime survive restarts.
     *
     * @return the keys written by this call
     */
    public Map<String, String> seedDefaults(StoreProperties.Lifecycle defaults) {
        Map<String, String> wanted = new LinkedHashMap<>();
        wanted.put(ConfigKeys.MAX_PROMPTS,                String.valueOf(defaults.maxPrompts()));
        wanted.put(ConfigKeys.MIN_RELEVANCE_SCORE,        String.valueOf(defaults.minRelevanceScore()));
        wanted.put(ConfigKeys.PROTECT_RELEVANCE_SCORE,    String.valueOf(defaults.protectRelevanceScore()));
        wanted.put(ConfigKeys.CLEANUP_HEADROOM,           String.valueOf(defaults.cleanupHeadroom()));
        wanted.put(ConfigKeys.RELEVANCE_HALF_LIFE_DAYS,   String.valueOf(defaults.halfLifeDays()));
        wanted.put(ConfigKeys.RELEVANCE_USAGE_WEIGHT,     String.valueOf(defaults.usageWeight()));
        wanted.put(ConfigKeys.RELEVANCE_USAGE_SATURATION, String.valueOf(defaults.usageSaturation()));

        Map<String, String> written = transactions.write("config.seed", () -> {
            Map<String, String> out = new LinkedHashMap<>();
            wanted.forEach((k, v) -> {
                if (!repository.existsById(k)) {
                    repository.save(new StoreConfigEntry(k, v));
                    out.put(k, v);
                }
            });
            return out;
        });
        if (!written.isEmpty()) log.info("[Config] Seeded defaults {}", written);
        return written;
    }

    private static void requireKey(String key) {
        if (key == null || key.isBlank()) throw StoreException.invalid("config key must not be blank");
    }
}
