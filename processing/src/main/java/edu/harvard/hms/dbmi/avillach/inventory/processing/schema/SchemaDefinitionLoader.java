package edu.harvard.hms.dbmi.avillach.inventory.processing.schema;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import edu.harvard.hms.dbmi.avillach.inventory.data.ingest.UploadFormat;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.DatasetDefinition;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.VariableConstraints;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.VariableDefinition;
import edu.harvard.hms.dbmi.avillach.inventory.data.schema.VariableType;
import edu.harvard.hms.dbmi.avillach.inventory.exception.ValidationException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Reads the declarative contract: {@code datasets.yaml} describes the source datasets, {@code variables.csv} lists one row per
 * variable with the column it is read from.
 */
@Component
public class SchemaDefinitionLoader {

    private static final Logger log = LoggerFactory.getLogger(SchemaDefinitionLoader.class);

    public static final String DATASETS_FILE = "datasets.yaml";
    public static final String VARIABLES_FILE = "variables.csv";

    private static final List<String> REQUIRED_HEADERS = List.of("dataset", "source_column", "variable_name", "is_required");
    private static final Set<String> TRUTHY = Set.of("true", "1", "yes", "y");

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public SchemaDefinitions load(Path schemaDirectory) throws ValidationException {
        return load(schemaDirectory.resolve(DATASETS_FILE), schemaDirectory.resolve(VARIABLES_FILE));
    }

    public SchemaDefinitions load(Path datasetsYaml, Path variablesCsv) throws ValidationException {
        Map<String, List<String>> errors = new LinkedHashMap<>();
        if (!Files.isRegularFile(datasetsYaml)) {
            error(errors, DATASETS_FILE, "missing required schema file at " + datasetsYaml.toAbsolutePath());
        }
        if (!Files.isRegularFile(variablesCsv)) {
            error(errors, VARIABLES_FILE, "missing required schema file at " + variablesCsv.toAbsolutePath());
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        JsonNode root = readYaml(datasetsYaml, errors);
        String participantIdColumn = root.path("participant_id_column").asText("participant_id");
        Map<String, DatasetDefinition> datasets = readDatasets(root, errors);
        List<VariableDefinition> variables = readVariables(variablesCsv, datasets.keySet(), participantIdColumn, errors);

        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        log.info("Loaded schema definitions: {} datasets, {} variables", datasets.size(), variables.size());
        for (DatasetDefinition dataset : datasets.values()) {
            log.info(
                "Dataset '{}': {} variables ({} required)", dataset.name(),
                variables.stream().filter(variable -> variable.dataset().equals(dataset.name())).count(),
                variables.stream().filter(variable -> variable.dataset().equals(dataset.name()) && variable.required()).count()
            );
        }
        return new SchemaDefinitions(List.copyOf(datasets.values()), variables, participantIdColumn);
    }

    private JsonNode readYaml(Path datasetsYaml, Map<String, List<String>> errors) throws ValidationException {
        JsonNode root;
        try {
            root = yamlMapper.readTree(datasetsYaml.toFile());
        } catch (IOException e) {
            error(errors, DATASETS_FILE, "unable to parse: " + e.getMessage());
            throw new ValidationException(errors);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return yamlMapper.createObjectNode();
        }
        if (!root.isObject()) {
            error(errors, DATASETS_FILE, "top level must be a mapping");
            throw new ValidationException(errors);
        }
        return root;
    }

    private Map<String, DatasetDefinition> readDatasets(JsonNode root, Map<String, List<String>> errors) {
        Map<String, DatasetDefinition> datasets = new TreeMap<>();
        JsonNode datasetsNode = root.path("datasets");
        if (!datasetsNode.isObject()) {
            error(errors, DATASETS_FILE, "must contain a top-level 'datasets' mapping");
            return datasets;
        }
        datasetsNode.fields().forEachRemaining(entry -> {
            String name = entry.getKey();
            JsonNode node = entry.getValue();
            JsonNode source = node.path("source");
            UploadFormat kind = null;
            if (source.hasNonNull("kind")) {
                try {
                    kind = UploadFormat.fromName(source.get("kind").asText());
                } catch (IllegalArgumentException e) {
                    error(errors, "dataset " + name, e.getMessage());
                }
            }
            Integer headerRow = source.hasNonNull("header_row") ? source.get("header_row").asInt() : null;
            datasets.put(
                name,
                new DatasetDefinition(
                    name, textOrNull(node, "description"), kind, textOrNull(source, "file_name"), textOrNull(source, "sheet_name"), headerRow
                )
            );
        });
        return datasets;
    }

    private List<VariableDefinition> readVariables(
        Path variablesCsv, Set<String> datasetNames, String participantIdColumn, Map<String, List<String>> errors
    ) throws ValidationException {
        List<VariableDefinition> variables = new ArrayList<>();
        Map<String, Map<String, String>> sourceToCanonical = new HashMap<>();
        Map<String, String> datasetOfVariable = new HashMap<>();
        Set<String> undeclaredDatasets = new TreeSet<>();

        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).setTrim(true).build();
        try (Reader reader = Files.newBufferedReader(variablesCsv, StandardCharsets.UTF_8); CSVParser parser = format.parse(reader)) {
            List<String> missingHeaders = REQUIRED_HEADERS.stream().filter(header -> !parser.getHeaderMap().containsKey(header)).toList();
            if (!missingHeaders.isEmpty()) {
                error(errors, VARIABLES_FILE, "missing required header(s): " + missingHeaders);
                throw new ValidationException(errors);
            }
            boolean hasType = parser.getHeaderMap().containsKey("type") || parser.getHeaderMap().containsKey("sql_type");
            if (!hasType) {
                error(errors, VARIABLES_FILE, "missing a 'type' or 'sql_type' header");
                throw new ValidationException(errors);
            }

            for (CSVRecord record : parser) {
                long line = record.getRecordNumber() + 1;
                String dataset = value(record, "dataset");
                String sourceColumn = value(record, "source_column");
                String name = value(record, "variable_name");
                if (dataset == null || sourceColumn == null || name == null) {
                    error(errors, VARIABLES_FILE, "line " + line + ": dataset/source_column/variable_name must be non-empty");
                    continue;
                }
                if (!datasetNames.contains(dataset)) {
                    undeclaredDatasets.add(dataset);
                    continue;
                }

                String previous = sourceToCanonical.computeIfAbsent(dataset, key -> new HashMap<>()).putIfAbsent(sourceColumn, name);
                if (previous != null && !previous.equals(name)) {
                    error(
                        errors, "dataset " + dataset,
                        "ambiguous mapping: source_column '" + sourceColumn + "' maps to both '" + previous + "' and '" + name + "'"
                    );
                    continue;
                }
                if (name.equals(participantIdColumn)) {
                    continue;
                }
                String otherDataset = datasetOfVariable.putIfAbsent(name, dataset);
                if (otherDataset != null) {
                    if (!otherDataset.equals(dataset)) {
                        error(errors, VARIABLES_FILE, "variable '" + name + "' is declared by datasets " + otherDataset + " and " + dataset);
                    }
                    continue;
                }

                try {
                    variables.add(toDefinition(record, dataset, sourceColumn, name));
                } catch (IllegalArgumentException e) {
                    error(errors, VARIABLES_FILE, "line " + line + ": " + e.getMessage());
                }
            }
        } catch (IOException e) {
            error(errors, VARIABLES_FILE, "unable to read: " + e.getMessage());
            throw new ValidationException(errors);
        }

        if (!undeclaredDatasets.isEmpty()) {
            error(errors, VARIABLES_FILE, "references dataset(s) not present in datasets.yaml: " + undeclaredDatasets);
        }
        return variables;
    }

    private VariableDefinition toDefinition(CSVRecord record, String dataset, String sourceColumn, String name) {
        String declaredType = value(record, "type");
        String sqlType = value(record, "sql_type");
        VariableType type;
        boolean integer = TRUTHY.contains(Objects.toString(value(record, "integer"), "").toLowerCase(Locale.ENGLISH));
        List<String> allowedValues = null;
        if (declaredType != null) {
            type = Arrays.stream(VariableType.values()).filter(candidate -> candidate.name().equalsIgnoreCase(declaredType)).findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unsupported type '" + declaredType + "' for " + name));
        } else if (sqlType != null) {
            String normalizedSqlType = sqlType.toUpperCase(Locale.ENGLISH);
            type = switch (normalizedSqlType) {
                case "INTEGER", "INT", "BIGINT", "REAL", "NUMERIC", "FLOAT", "DOUBLE", "DECIMAL" -> VariableType.NUMERIC;
                case "DATE" -> VariableType.DATE;
                case "BOOLEAN" -> VariableType.CATEGORICAL;
                case "TEXT", "VARCHAR" -> VariableType.TEXT;
                default -> throw new IllegalArgumentException("unsupported sql_type '" + sqlType + "' for " + name);
            };
            integer = integer || Set.of("INTEGER", "INT", "BIGINT").contains(normalizedSqlType);
            if (normalizedSqlType.equals("BOOLEAN")) {
                allowedValues = List.of("true", "false");
            }
        } else {
            throw new IllegalArgumentException("variable " + name + " has no type");
        }

        String declaredAllowed = value(record, "allowed_values");
        if (declaredAllowed != null) {
            allowedValues = Arrays.stream(declaredAllowed.split("\\|")).map(String::trim).filter(value -> !value.isEmpty()).toList();
        }
        Double min = number(record, "min");
        Double max = number(record, "max");
        VariableConstraints constraints = VariableConstraints.NONE;
        if (type == VariableType.NUMERIC && (min != null || max != null || integer)) {
            constraints = VariableConstraints.range(min, max, integer);
        } else if (type == VariableType.CATEGORICAL && allowedValues != null) {
            constraints = VariableConstraints.enumeration(allowedValues);
        }

        boolean required = TRUTHY.contains(Objects.toString(value(record, "is_required"), "").toLowerCase(Locale.ENGLISH));
        String nullableValue = value(record, "nullable");
        Boolean nullable = nullableValue == null ? !required : TRUTHY.contains(nullableValue.toLowerCase(Locale.ENGLISH));
        return new VariableDefinition(
            name, dataset, type, nullable, required, constraints, sourceColumn.equals(name) ? null : sourceColumn, false,
            value(record, "description")
        );
    }

    private static String value(CSVRecord record, String header) {
        if (!record.isMapped(header) || !record.isSet(header)) {
            return null;
        }
        String value = record.get(header).trim();
        return value.isEmpty() ? null : value;
    }

    private static Double number(CSVRecord record, String header) {
        String value = value(record, header);
        if (value == null) {
            return null;
        }
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(header + " '" + value + "' is not a number");
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }

    private static void error(Map<String, List<String>> errors, String key, String message) {
        log.error("{}: {}", key, message);
        errors.computeIfAbsent(key, k -> new ArrayList<>()).add(message);
    }
}
