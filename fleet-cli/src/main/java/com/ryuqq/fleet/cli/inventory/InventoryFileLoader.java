package com.ryuqq.fleet.cli.inventory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.ryuqq.fleet.core.exception.DefinitionException;
import com.ryuqq.fleet.core.inventory.Inventory;
import com.ryuqq.fleet.core.inventory.InventoryDefinition;
import com.ryuqq.fleet.core.inventory.InventoryDefinition.GroupDefinition;
import com.ryuqq.fleet.core.inventory.InventoryDefinition.HostDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 명령행 인벤토리 인자 해석.
 *
 * <p><strong>지원 형식:</strong></p>
 * <ul>
 *   <li>YAML 파일 경로 (.yml, .yaml)</li>
 *   <li>{@code @local}: 로컬 Host 하나</li>
 *   <li>쉼표로 구분한 Host 이름 목록 (예: {@code web1,web2,db1})</li>
 * </ul>
 *
 * <p><strong>YAML 형식:</strong></p>
 * <pre>
 * hosts:
 *   web1.example.com:
 *     ssh_user: ubuntu
 *   db1.example.com: {}
 * groups:
 *   web:
 *     hosts: [web1.example.com]
 *     data:
 *       env: prod
 *   all:
 *     data:
 *       ssh_port: 2222
 * </pre>
 *
 * <p>{@code hosts}는 이름 목록으로도 쓸 수 있고, 그룹은 {@code web: [web1, web2]}처럼
 * Host 목록만으로도 선언할 수 있습니다.</p>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class InventoryFileLoader {

    private static final Logger log = LoggerFactory.getLogger(InventoryFileLoader.class);

    private static final TypeReference<LinkedHashMap<String, Object>> DATA_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper yamlMapper;

    public InventoryFileLoader() {
        this(new ObjectMapper(new YAMLFactory()));
    }

    public InventoryFileLoader(ObjectMapper yamlMapper) {
        if (yamlMapper == null) {
            throw new IllegalArgumentException("yamlMapper cannot be null");
        }
        this.yamlMapper = yamlMapper;
    }

    /**
     * 인벤토리 인자로부터 Inventory 적재.
     *
     * @param source 파일 경로, {@code @local}, 또는 쉼표 구분 Host 목록
     * @param overrides 실행 시 데이터 override
     * @return Inventory
     * @throws DefinitionException 인자가 비었거나 파일을 읽거나 해석할 수 없는 경우
     */
    public Inventory load(String source, Map<String, Object> overrides) {
        return Inventory.load(parse(source), overrides);
    }

    /**
     * 인벤토리 인자를 정의로 해석.
     *
     * @param source 파일 경로, {@code @local}, 또는 쉼표 구분 Host 목록
     * @return InventoryDefinition
     */
    public InventoryDefinition parse(String source) {
        if (source == null || source.isBlank()) {
            throw new DefinitionException("Inventory cannot be blank");
        }
        String trimmed = source.trim();
        if (isYamlPath(trimmed)) {
            Path file = Path.of(trimmed);
            if (!Files.isRegularFile(file)) {
                throw new DefinitionException("No inventory file: " + trimmed);
            }
            return parseFile(file);
        }
        List<String> names = Arrays.stream(trimmed.split(","))
            .map(String::trim)
            .filter(name -> !name.isEmpty())
            .toList();
        if (names.isEmpty()) {
            throw new DefinitionException("Inventory cannot be blank");
        }
        return InventoryDefinition.ofHosts(names);
    }

    /**
     * YAML 인벤토리 파일 해석.
     *
     * @param file 파일 경로
     * @return InventoryDefinition
     * @throws DefinitionException 읽기 또는 해석 실패
     */
    public InventoryDefinition parseFile(Path file) {
        JsonNode root;
        try {
            root = yamlMapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new DefinitionException("Invalid inventory file " + file + ": " + e.getMessage(), e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new DefinitionException("Empty inventory file: " + file);
        }
        if (!root.isObject()) {
            throw new DefinitionException("Inventory file must be a mapping: " + file);
        }
        List<HostDefinition> hosts = parseHosts(root.get("hosts"), file);
        List<GroupDefinition> groups = parseGroups(root.get("groups"), file);
        log.debug("Loaded inventory {}: {} hosts, {} groups", file, hosts.size(), groups.size());
        return new InventoryDefinition(hosts, groups);
    }

    private List<HostDefinition> parseHosts(JsonNode node, Path file) {
        List<HostDefinition> hosts = new ArrayList<>();
        if (node == null || node.isNull()) {
            return hosts;
        }
        if (node.isArray()) {
            for (JsonNode name : node) {
                hosts.add(new HostDefinition(textOf(name, "host name", file), Map.of()));
            }
            return hosts;
        }
        if (!node.isObject()) {
            throw new DefinitionException("'hosts' must be a list or mapping in " + file);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            hosts.add(new HostDefinition(field.getKey(), dataOf(field.getValue(), field.getKey(), file)));
        }
        return hosts;
    }

    private List<GroupDefinition> parseGroups(JsonNode node, Path file) {
        List<GroupDefinition> groups = new ArrayList<>();
        if (node == null || node.isNull()) {
            return groups;
        }
        if (!node.isObject()) {
            throw new DefinitionException("'groups' must be a mapping in " + file);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            JsonNode value = field.getValue();
            if (value == null || value.isNull()) {
                groups.add(new GroupDefinition(name, List.of(), Map.of()));
            } else if (value.isArray()) {
                groups.add(new GroupDefinition(name, namesOf(value, file), Map.of()));
            } else if (value.isObject()) {
                JsonNode members = value.get("hosts");
                List<String> hostNames = members == null || members.isNull() ? List.of() : namesOf(members, file);
                groups.add(new GroupDefinition(name, hostNames, dataOf(value.get("data"), name, file)));
            } else {
                throw new DefinitionException("Group '" + name + "' must be a list or mapping in " + file);
            }
        }
        return groups;
    }

    private List<String> namesOf(JsonNode node, Path file) {
        if (!node.isArray()) {
            throw new DefinitionException("Group hosts must be a list in " + file);
        }
        List<String> names = new ArrayList<>();
        for (JsonNode name : node) {
            names.add(textOf(name, "host name", file));
        }
        return names;
    }

    private Map<String, Object> dataOf(JsonNode node, String owner, Path file) {
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new DefinitionException("Data of '" + owner + "' must be a mapping in " + file);
        }
        return yamlMapper.convertValue(node, DATA_TYPE);
    }

    private static String textOf(JsonNode node, String what, Path file) {
        if (node == null || node.isNull() || !node.isValueNode() || node.asText().isBlank()) {
            throw new DefinitionException("Invalid " + what + " in " + file);
        }
        return node.asText();
    }

    private static boolean isYamlPath(String source) {
        return source.endsWith(".yml") || source.endsWith(".yaml");
    }
}
