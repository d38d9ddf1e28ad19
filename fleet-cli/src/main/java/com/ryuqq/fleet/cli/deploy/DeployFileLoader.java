package com.ryuqq.fleet.cli.deploy;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.ryuqq.fleet.application.deploy.Deploy;
import com.ryuqq.fleet.cli.registry.OperationRegistry;
import com.ryuqq.fleet.core.exception.DefinitionException;
import com.ryuqq.fleet.core.operation.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * YAML Deploy 파일 적재.
 *
 * <p><strong>파일 형식:</strong></p>
 * <pre>
 * operations:
 *   - name: Install nginx
 *     op: apt.packages
 *     hosts: [web]
 *     args:
 *       packages: [nginx]
 *       update: true
 *   - include: tasks/users.yml
 *   - name: Restart
 *     op: server.shell
 *     args:
 *       commands: [systemctl restart nginx]
 * </pre>
 *
 * <p>최상위가 목록이면 그 목록을 단계 목록으로 사용합니다. include 경로는 include하는 파일의
 * 디렉터리 기준 상대 경로이며, include한 파일의 Operation 이름에는 include 경로가 접두어로 붙습니다.</p>
 *
 * <p>각 단계의 호출 위치 라벨은 {@code 파일이름#순번}이므로, 같은 파일을 다른 위치에서
 * include하면 별개의 Operation으로 기록됩니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class DeployFileLoader {

    private static final Logger log = LoggerFactory.getLogger(DeployFileLoader.class);

    private static final TypeReference<LinkedHashMap<String, Object>> ARGS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper yamlMapper;
    private final OperationRegistry operations;

    public DeployFileLoader(OperationRegistry operations) {
        this(new ObjectMapper(new YAMLFactory()), operations);
    }

    public DeployFileLoader(ObjectMapper yamlMapper, OperationRegistry operations) {
        if (yamlMapper == null) {
            throw new IllegalArgumentException("yamlMapper cannot be null");
        }
        if (operations == null) {
            throw new IllegalArgumentException("operations cannot be null");
        }
        this.yamlMapper = yamlMapper;
        this.operations = operations;
    }

    /**
     * Deploy 파일을 읽어 Deploy 정의 생성.
     *
     * @param file Deploy 파일
     * @return Deploy
     * @throws DefinitionException 파일이 없거나 형식이 잘못된 경우
     */
    public Deploy load(Path file) {
        List<DeployStep> steps = loadSteps(file);
        return ctx -> {
            for (DeployStep step : steps) {
                step.apply(ctx);
            }
        };
    }

    /**
     * Deploy 파일을 단계 목록으로 해석.
     *
     * @param file Deploy 파일
     * @return 단계 목록 (include 포함)
     * @throws DefinitionException 파일이 없거나 형식이 잘못된 경우, include가 순환하는 경우
     */
    public List<DeployStep> loadSteps(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("file cannot be null");
        }
        return loadSteps(file, new ArrayDeque<>());
    }

    private List<DeployStep> loadSteps(Path file, Deque<Path> including) {
        Path normalized = file.toAbsolutePath().normalize();
        if (including.contains(normalized)) {
            throw new DefinitionException("Circular include: " + file);
        }
        if (!Files.isRegularFile(normalized)) {
            throw new DefinitionException("No deploy file: " + file);
        }
        including.push(normalized);
        try {
            List<DeployStep> steps = parseSteps(readSteps(normalized), file, including);
            log.debug("Loaded deploy {}: {} steps", file, steps.size());
            return steps;
        } finally {
            including.pop();
        }
    }

    private JsonNode readSteps(Path file) {
        JsonNode root;
        try {
            root = yamlMapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new DefinitionException("Invalid deploy file " + file + ": " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            return yamlMapper.createArrayNode();
        }
        if (root.isObject()) {
            JsonNode steps = root.get("operations");
            if (steps == null || steps.isNull()) {
                return yamlMapper.createArrayNode();
            }
            root = steps;
        }
        if (!root.isArray()) {
            throw new DefinitionException("Deploy operations must be a list in " + file);
        }
        return root;
    }

    private List<DeployStep> parseSteps(JsonNode nodes, Path file, Deque<Path> including) {
        String fileLabel = file.getFileName().toString();
        List<DeployStep> steps = new ArrayList<>();
        int index = 0;
        for (JsonNode node : nodes) {
            index++;
            String label = fileLabel + "#" + index;
            if (!node.isObject()) {
                throw new DefinitionException("Step " + label + " must be a mapping");
            }
            List<String> hosts = hostsOf(node, label);
            JsonNode include = node.get("include");
            if (include != null) {
                String target = textOf(include, "include", label);
                Path resolved = resolveSibling(file, target);
                steps.add(new DeployStep.IncludeStep(target, loadSteps(resolved, including), hosts, label));
                continue;
            }
            String type = textOf(node.get("op"), "op", label);
            JsonNode nameNode = node.get("name");
            String name = nameNode == null || nameNode.isNull() ? type : textOf(nameNode, "name", label);
            Operation operation = operations.create(type, argsOf(node.get("args"), label));
            steps.add(new DeployStep.OperationStep(name, operation, hosts, label));
        }
        return steps;
    }

    private Map<String, Object> argsOf(JsonNode node, String label) {
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new DefinitionException("'args' of " + label + " must be a mapping");
        }
        return yamlMapper.convertValue(node, ARGS_TYPE);
    }

    private static List<String> hostsOf(JsonNode node, String label) {
        JsonNode hosts = node.get("hosts");
        if (hosts == null || hosts.isNull()) {
            return List.of();
        }
        if (hosts.isValueNode()) {
            return List.of(textOf(hosts, "hosts", label));
        }
        if (!hosts.isArray()) {
            throw new DefinitionException("'hosts' of " + label + " must be a list");
        }
        List<String> patterns = new ArrayList<>();
        for (JsonNode pattern : hosts) {
            patterns.add(textOf(pattern, "hosts", label));
        }
        return patterns;
    }

    private static String textOf(JsonNode node, String field, String label) {
        if (node == null || node.isNull() || !node.isValueNode() || node.asText().isBlank()) {
            throw new DefinitionException("Missing or invalid '" + field + "' in " + label);
        }
        return node.asText();
    }

    private static Path resolveSibling(Path file, String target) {
        Path parent = file.toAbsolutePath().getParent();
        return parent == null ? Path.of(target) : parent.resolve(target);
    }
}
