package com.anomalywatch.investigator;

import com.anomalywatch.exception.UnknownInvestigatorTypeException;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps investigator type codes to constructors.
 *
 * Codes are case-insensitive ("Invoice" and "invoice" are the same type).
 * Registering a code again replaces the previous constructor. New investigator
 * kinds only need a register call; InvestigationManager does not change.
 */
@Slf4j
public class InvestigatorRegistry {

    private final Map<String, InvestigatorConstructor> constructors = new ConcurrentHashMap<>();

    public void register(String typeCode, InvestigatorConstructor constructor) {
        if (constructor == null) {
            throw new IllegalArgumentException("Investigator constructor cannot be null");
        }
        InvestigatorConstructor previous = constructors.put(normalize(typeCode), constructor);
        if (previous != null) {
            log.info("Replaced investigator constructor for type {}", typeCode);
        } else {
            log.info("Registered investigator type {}", typeCode);
        }
    }

    /**
     * Build an investigator of the given type bound to the context.
     *
     * @throws UnknownInvestigatorTypeException if no constructor is registered for the code
     */
    public Investigator create(String typeCode, InvestigatorContext context) {
        InvestigatorConstructor constructor = typeCode == null ? null : constructors.get(normalize(typeCode));
        if (constructor == null) {
            throw new UnknownInvestigatorTypeException(typeCode);
        }
        return constructor.construct(context);
    }

    public boolean isRegistered(String typeCode) {
        return typeCode != null && !typeCode.isBlank() && constructors.containsKey(normalize(typeCode));
    }

    /**
     * @return Registered codes in lower case, sorted
     */
    public Set<String> registeredTypes() {
        return new TreeSet<>(constructors.keySet());
    }

    private static String normalize(String typeCode) {
        if (typeCode == null || typeCode.isBlank()) {
            throw new IllegalArgumentException("Investigator type code cannot be null or empty");
        }
        return typeCode.trim().toLowerCase(Locale.ROOT);
    }
}
