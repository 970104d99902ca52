package edu.harvard.hms.dbmi.avillach.cohort.data.query;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import edu.harvard.hms.dbmi.avillach.cohort.exception.MalformedSerializationException;
import edu.harvard.hms.dbmi.avillach.cohort.exception.NotImplementedBehaviorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Named code lists, read from YAML. Top-level keys are criterion class names; each holds a list of entries with a {@code name}
 * and one list of codes per coding scheme:
 *
 * <pre>
 * Diagnosis:
 *   - name: acute kidney failure
 *     ICD-9: ["584.9"]
 *     ICD-10: [N17, N17.9]
 * </pre>
 *
 * Codes are compared as text, so quote codes whose trailing zeros matter.
 */
public class ConditionStore {

    private static final Logger log = LoggerFactory.getLogger(ConditionStore.class);

    public static final String DEFAULT_RESOURCE = "conditions.yml";

    public static final String NAME = "name";

    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    private final Map<String, List<Map<String, Object>>> definitions;

    public ConditionStore(Map<String, List<Map<String, Object>>> definitions) {
        if (definitions == null) {
            throw new IllegalArgumentException("Condition definitions must not be null");
        }
        ImmutableMap.Builder<String, List<Map<String, Object>>> builder = ImmutableMap.builder();
        definitions.forEach((className, entries) -> builder.put(className, entries == null ? List.of() : ImmutableList.copyOf(entries)));
        this.definitions = builder.build();
    }

    public static ConditionStore fromYaml(InputStream yaml) {
        try {
            Map<String, List<Map<String, Object>>> definitions =
                yamlMapper.readValue(yaml, new TypeReference<Map<String, List<Map<String, Object>>>>() {});
            return new ConditionStore(definitions == null ? Map.of() : definitions);
        } catch (IOException e) {
            throw new MalformedSerializationException("Not a valid condition store", e);
        }
    }

    public static ConditionStore fromFile(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            log.info("Loading stored conditions from {}", path);
            return fromYaml(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read condition store " + path, e);
        }
    }

    /**
     * Loads a store from the class path, {@link #DEFAULT_RESOURCE} unless another resource is named.
     */
    public static ConditionStore fromClasspath(String resource) {
        InputStream in = ConditionStore.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("No condition store on the class path at " + resource);
        }
        try (in) {
            log.info("Loading stored conditions from class path resource {}", resource);
            return fromYaml(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read condition store " + resource, e);
        }
    }

    public static ConditionStore fromClasspath() {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    /**
     * Names stored for {@code kind}, in file order.
     */
    public List<String> availableConditions(CriterionKind kind) {
        return entries(kind).stream().map(entry -> String.valueOf(entry.get(NAME))).toList();
    }

    /**
     * The disjunction of every code stored under {@code name} for each of the coding schemes, labelled {@code name}. Codes of one
     * relation fold into a single merged criterion.
     *
     * @throws IllegalArgumentException when no condition of that name is stored, or it lists no codes for the given schemes
     */
    public Predicate condition(CriterionKind kind, String name, List<String> codingSchemes) {
        if (codingSchemes == null || codingSchemes.isEmpty()) {
            throw new IllegalArgumentException("At least one coding scheme is required");
        }
        if (kind.getParameterType() != FactParameters.class && kind.getParameterType() != DrugParameters.class) {
            throw new NotImplementedBehaviorException(kind.getClassName() + " criteria cannot be built from codes");
        }
        Map<String, Object> entry = entries(kind).stream()
            .filter(candidate -> Objects.equals(name, String.valueOf(candidate.get(NAME))))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("No " + kind.getClassName() + " condition named " + name));

        Predicate condition = null;
        int codeCount = 0;
        for (String scheme : codingSchemes) {
            for (String code : codes(entry, scheme)) {
                Map<String, Object> attributes = new LinkedHashMap<>();
                attributes.put("code", code);
                attributes.put("context", scheme);
                Criterion criterion = new Criterion(kind, kind.readParameters(attributes));
                condition = condition == null ? criterion : Predicates.combine(condition, criterion, Operator.OR);
                codeCount++;
            }
        }
        if (condition == null) {
            throw new IllegalArgumentException("Condition " + name + " lists no codes for " + codingSchemes);
        }
        log.debug("Built {} from {} codes", name, codeCount);
        return condition.withLabel(name);
    }

    private List<Map<String, Object>> entries(CriterionKind kind) {
        return definitions.getOrDefault(kind.getClassName(), List.of());
    }

    private static List<String> codes(Map<String, Object> entry, String scheme) {
        Object codes = entry.get(scheme);
        if (codes == null) {
            return List.of();
        }
        if (!(codes instanceof Collection<?> collection)) {
            return List.of(String.valueOf(codes));
        }
        return collection.stream().filter(Objects::nonNull).map(String::valueOf).toList();
    }
}
