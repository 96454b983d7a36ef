package edu.harvard.hms.dbmi.avillach.inventory.processing.schema;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.common.collect.ImmutableSortedMap;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.DatasetDefinition;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.SchemaVersion;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.VariableDefinition;
import edu.harvard.hms.dbmi.avillach.inventory.exception.SchemaConflictException;
import edu.harvard.hms.dbmi.avillach.inventory.exception.UnknownVersionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Versioned catalogue of datasets and variables. Published versions are immutable and persisted as one JSON file each; readers only
 * ever see a fully published version because the version map is replaced atomically after the file has been written.
 */
@Component
public class SchemaRegistry {

    private static final Logger log = LoggerFactory.getLogger(SchemaRegistry.class);

    private static final Pattern VERSION_FILE = Pattern.compile("schema-v(\\d+)\\.json");

    private final Path schemaDirectory;

    private final ObjectMapper mapper;

    private final Clock clock;

    private final Object publishLock = new Object();

    private volatile ImmutableSortedMap<Integer, SchemaVersion> versions = ImmutableSortedMap.of();

    @Autowired
    public SchemaRegistry(@Value("${INVENTORY_DATA_DIRECTORY:/opt/local/inventory/}") String dataDirectory) {
        this(Path.of(dataDirectory, "schema"), Clock.systemUTC());
    }

    public SchemaRegistry(Path schemaDirectory, Clock clock) {
        this.schemaDirectory = schemaDirectory;
        this.clock = clock;
        this.mapper = new ObjectMapper().registerModule(new JavaTimeModule()).disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
        loadPublishedVersions();
    }

    /**
     * Publishes a new version consisting of the current version amended with {@code definitions}.
     *
     * @throws SchemaConflictException if a name is reused with an incompatible type or a definition is invalid
     */
    public SchemaVersion publish(Collection<VariableDefinition> definitions) {
        return publish(definitions, List.of());
    }

    public SchemaVersion publish(Collection<VariableDefinition> definitions, Collection<DatasetDefinition> datasets) {
        synchronized (publishLock) {
            Optional<SchemaVersion> base = latest();
            List<String> conflicts = new ArrayList<>();
            if (definitions.isEmpty() && datasets.isEmpty()) {
                conflicts.add("draft contains no definitions");
            }

            Map<String, VariableDefinition> draft = new LinkedHashMap<>();
            for (VariableDefinition definition : definitions) {
                List<String> problems = definition.problems();
                if (!problems.isEmpty()) {
                    conflicts.addAll(problems);
                    continue;
                }
                VariableDefinition sameName = draft.get(definition.name());
                if (sameName != null && sameName.type() != definition.type()) {
                    conflicts.add(
                        "variable " + definition.name() + " is declared as both " + sameName.type() + " and " + definition.type()
                    );
                } else if (sameName != null && !sameName.equals(definition)) {
                    conflicts.add("variable " + definition.name() + " is declared twice with different definitions");
                }
                VariableDefinition published = base.flatMap(version -> version.definition(definition.name())).orElse(null);
                if (published != null && published.type() != definition.type()) {
                    conflicts.add(
                        "variable " + definition.name() + " is " + published.type() + " in version " + base.get().version()
                            + " and cannot be redefined as " + definition.type()
                    );
                }
                draft.put(definition.name(), definition);
            }
            for (DatasetDefinition dataset : datasets) {
                if (dataset.name() == null || dataset.name().isBlank()) {
                    conflicts.add("dataset name must not be blank");
                }
            }

            if (!conflicts.isEmpty()) {
                log.error("Rejected schema draft: {}", conflicts);
                throw new SchemaConflictException(conflicts);
            }
            return store(base, draft.values(), datasets);
        }
    }

    /**
     * Publishes a new version in which {@code variableName} carries the retired marker. Retiring a retired variable is a no-op.
     */
    public SchemaVersion retire(String variableName) {
        synchronized (publishLock) {
            SchemaVersion current = current();
            VariableDefinition definition = current.definition(variableName).orElseThrow(
                () -> new SchemaConflictException(List.of("variable " + variableName + " does not exist in version " + current.version()))
            );
            if (definition.retired()) {
                return current;
            }
            log.info("Retiring variable {} (version {})", variableName, current.version());
            return store(Optional.of(current), List.of(definition.asRetired()), List.of());
        }
    }

    public SchemaVersion get(int version) {
        SchemaVersion schemaVersion = versions.get(version);
        if (schemaVersion == null) {
            throw new UnknownVersionException(version);
        }
        return schemaVersion;
    }

    /**
     * @throws UnknownVersionException if nothing has been published yet
     */
    public SchemaVersion current() {
        return latest().orElseThrow(() -> new UnknownVersionException(null));
    }

    public Optional<SchemaVersion> latest() {
        ImmutableSortedMap<Integer, SchemaVersion> snapshot = versions;
        return snapshot.isEmpty() ? Optional.empty() : Optional.of(snapshot.lastEntry().getValue());
    }

    public List<Integer> versions() {
        return List.copyOf(versions.keySet());
    }

    private SchemaVersion store(
        Optional<SchemaVersion> base, Collection<VariableDefinition> definitions, Collection<DatasetDefinition> datasets
    ) {
        Map<String, VariableDefinition> variables = new TreeMap<>(base.map(SchemaVersion::variables).orElse(ImmutableSortedMap.of()));
        Map<String, DatasetDefinition> datasetMap = new TreeMap<>(base.map(SchemaVersion::datasets).orElse(ImmutableSortedMap.of()));
        datasets.forEach(dataset -> datasetMap.put(dataset.name(), dataset));
        for (VariableDefinition definition : definitions) {
            variables.put(definition.name(), definition);
            datasetMap.computeIfAbsent(definition.dataset(), DatasetDefinition::named);
        }

        int number = base.map(SchemaVersion::version).orElse(0) + 1;
        SchemaVersion version = new SchemaVersion(number, clock.instant(), variables, datasetMap);
        write(version);
        versions = ImmutableSortedMap.<Integer, SchemaVersion>naturalOrder().putAll(versions).put(number, version).build();
        log.info(
            "Published schema version {}: {} variables ({} active), {} datasets", number, variables.size(),
            version.getActiveDefinitions().size(), datasetMap.size()
        );
        return version;
    }

    private void write(SchemaVersion version) {
        try {
            Files.createDirectories(schemaDirectory);
            Path target = schemaDirectory.resolve("schema-v" + version.version() + ".json");
            Path temp = schemaDirectory.resolve(target.getFileName() + ".tmp");
            mapper.writeValue(temp.toFile(), version);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to persist schema version " + version.version(), e);
        }
    }

    private void loadPublishedVersions() {
        if (!Files.isDirectory(schemaDirectory)) {
            log.info("No schema directory at {}, starting without published versions", schemaDirectory);
            return;
        }
        ImmutableSortedMap.Builder<Integer, SchemaVersion> loaded = ImmutableSortedMap.naturalOrder();
        try (Stream<Path> files = Files.list(schemaDirectory)) {
            for (Path file : files.toList()) {
                Matcher matcher = VERSION_FILE.matcher(file.getFileName().toString());
                if (matcher.matches()) {
                    SchemaVersion version = mapper.readValue(file.toFile(), SchemaVersion.class);
                    loaded.put(version.version(), version);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to load schema versions from " + schemaDirectory, e);
        }
        versions = loaded.build();
        log.info("Loaded {} schema version(s) from {}", versions.size(), schemaDirectory);
    }
}
