package com.fintech.signals.registry;

import com.fintech.signals.config.SignalProperties;
import com.fintech.signals.domain.AssetCategory;
import com.fintech.signals.domain.Instrument;
import com.fintech.signals.error.InstrumentNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable catalog of tracked instruments, keyed by canonical id.
 * Iteration order is the configuration order.
 */
public class InstrumentRegistry {

    private static final Logger log = LoggerFactory.getLogger(InstrumentRegistry.class);

    private final Map<String, Instrument> byId;
    private final Map<String, Instrument> bySymbol;
    private final Map<AssetCategory, List<Instrument>> byCategory;

    public InstrumentRegistry(List<Instrument> instruments) {
        Map<String, Instrument> ids = new LinkedHashMap<>();
        Map<String, Instrument> symbols = new LinkedHashMap<>();
        for (Instrument instrument : instruments) {
            if (ids.putIfAbsent(instrument.id(), instrument) != null) {
                throw new IllegalStateException("Duplicate instrument id: " + instrument.id());
            }
            if (symbols.putIfAbsent(instrument.symbol().toUpperCase(Locale.ROOT), instrument) != null) {
                throw new IllegalStateException("Duplicate instrument symbol: " + instrument.symbol());
            }
        }
        this.byId = Collections.unmodifiableMap(ids);
        this.bySymbol = Collections.unmodifiableMap(symbols);

        Map<AssetCategory, List<Instrument>> categories = new EnumMap<>(AssetCategory.class);
        for (AssetCategory category : AssetCategory.values()) {
            categories.put(category, ids.values().stream()
                .filter(instrument -> instrument.category() == category)
                .collect(Collectors.toUnmodifiableList()));
        }
        this.byCategory = Collections.unmodifiableMap(categories);
    }

    /**
     * Builds the registry from {@code signals.instruments}.
     *
     * @throws IllegalStateException if the list is empty or has duplicates
     */
    public static InstrumentRegistry fromProperties(SignalProperties properties) {
        List<Instrument> instruments = properties.getInstruments().stream()
            .map(config -> new Instrument(
                config.getId(),
                config.getSymbol(),
                config.getName(),
                config.getCategory(),
                config.getDescription()))
            .collect(Collectors.toList());
        if (instruments.isEmpty()) {
            throw new IllegalStateException("No instruments configured under signals.instruments");
        }
        InstrumentRegistry registry = new InstrumentRegistry(instruments);
        log.info("Instrument registry loaded: {} instruments ({})", instruments.size(), registry.categoryCounts());
        return registry;
    }

    /**
     * Resolves an exact canonical id or a case-insensitive symbol.
     *
     * @throws InstrumentNotFoundException when nothing matches
     */
    public Instrument resolve(String idOrSymbol) {
        return find(idOrSymbol).orElseThrow(() -> new InstrumentNotFoundException(idOrSymbol,
            "Unknown instrument '" + idOrSymbol + "'. Available: " + String.join(", ", symbols())));
    }

    public Optional<Instrument> find(String idOrSymbol) {
        if (idOrSymbol == null || idOrSymbol.isBlank()) {
            return Optional.empty();
        }
        String key = idOrSymbol.trim();
        Instrument instrument = byId.get(key);
        if (instrument == null) {
            instrument = bySymbol.get(key.toUpperCase(Locale.ROOT));
        }
        return Optional.ofNullable(instrument);
    }

    public List<Instrument> all() {
        return List.copyOf(byId.values());
    }

    public List<Instrument> byCategory(AssetCategory category) {
        return byCategory.get(category);
    }

    public List<String> symbols() {
        return byId.values().stream().map(Instrument::symbol).collect(Collectors.toList());
    }

    public int size() {
        return byId.size();
    }

    private Map<AssetCategory, Integer> categoryCounts() {
        Map<AssetCategory, Integer> counts = new EnumMap<>(AssetCategory.class);
        byCategory.forEach((category, list) -> counts.put(category, list.size()));
        return counts;
    }
}
