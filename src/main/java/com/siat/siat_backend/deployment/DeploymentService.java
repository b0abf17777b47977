package com.siat.siat_backend.deployment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.siat.siat_backend.FlowStatus;
import com.siat.siat_backend.model.deployment.DeploymentConfig;
import com.siat.siat_backend.model.deployment.DeploymentManifest;
import com.siat.siat_backend.model.deployment.DeploymentResult;
import com.siat.siat_backend.model.deployment.DeploymentStatus;
import com.siat.siat_backend.model.domain.Flow;
import com.siat.siat_backend.model.domain.FlowType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Writes a generated flow to its own directory under the deployment root:
 * sources under src/, tsconfig.json, package.json for API and CRUD modules, Docker files when
 * containerized, and a deployment.json manifest. Nothing is built or started.
 */
@Slf4j
@Service
public class DeploymentService {

    static final String MANIFEST = "deployment.json";
    private static final List<String> REQUIRED_FILES = List.of(MANIFEST, "package.json", "tsconfig.json");

    private static final int MAX_ID_ATTEMPTS = 100;

    private final Path root;
    private final ObjectMapper mapper;
    private final Clock clock;

    @Autowired
    public DeploymentService(@Value("${siat.deployment.path:./generated-modules}") String deploymentPath,
                             ObjectMapper mapper) {
        this(deploymentPath, mapper, Clock.systemUTC());
    }

    DeploymentService(String deploymentPath, ObjectMapper mapper, Clock clock) {
        this.root = Paths.get(deploymentPath);
        this.mapper = mapper;
        this.clock = clock;
    }

    public DeploymentResult deploy(Flow flow, DeploymentConfig config) {
        log.info("[Deploy] Deploying flow: {}", flow.getId());

        if (flow.getGeneratedCode() == null || flow.getGeneratedCode().isEmpty()) {
            return failed(flow, "Flow has no generated code to deploy");
        }
        if (flow.getStatus() != FlowStatus.GENERATED) {
            return failed(flow, "Flow must be in GENERATED status to deploy");
        }

        Path dir;
        try {
            dir = claimDirectory(flow);
        } catch (IOException e) {
            log.error("[Deploy] Could not create a deployment directory for flow {}", flow.getId(), e);
            return DeploymentResult.failure("Deployment failed: " + e.getMessage());
        }

        String deploymentId = dir.getFileName().toString();
        try {
            writeGeneratedFiles(dir, flow, config);
            writeManifest(dir, flow, deploymentId);

            List<String> errors = validateDeployment(dir);
            if (!errors.isEmpty()) {
                removeQuietly(dir);
                return failed(flow, "Deployment validation failed: " + String.join(", ", errors));
            }

            log.info("[Deploy] Flow deployed successfully: {}", deploymentId);
            return DeploymentResult.ok("Flow deployed successfully", deploymentId);
        } catch (IOException | UncheckedIOException e) {
            log.error("[Deploy] Writing deployment {} failed", deploymentId, e);
            removeQuietly(dir);
            return DeploymentResult.failure("Deployment failed: " + e.getMessage());
        }
    }

    public DeploymentResult undeploy(String deploymentId) {
        Path dir = resolveDeployment(deploymentId);
        if (dir == null || !Files.isDirectory(dir)) {
            return DeploymentResult.failure("Deployment not found");
        }
        try {
            deleteRecursively(dir);
            log.info("[Deploy] Flow undeployed successfully: {}", deploymentId);
            return DeploymentResult.ok("Flow undeployed successfully", deploymentId);
        } catch (IOException | UncheckedIOException e) {
            log.error("[Deploy] Undeployment of {} failed", deploymentId, e);
            return DeploymentResult.failure("Undeployment failed: " + e.getMessage());
        }
    }

    public DeploymentStatus getDeploymentStatus(String deploymentId) {
        Path dir = resolveDeployment(deploymentId);
        if (dir == null || !Files.isRegularFile(dir.resolve(MANIFEST))) {
            return new DeploymentStatus(DeploymentStatus.NOT_FOUND, null);
        }
        try {
            DeploymentManifest manifest = mapper.readValue(dir.resolve(MANIFEST).toFile(), DeploymentManifest.class);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("deploymentId", deploymentId);
            details.put("flowId", manifest.getFlowId());
            details.put("deployedAt", manifest.getDeployedAt());
            details.put("version", manifest.getVersion());
            details.put("files", manifest.getFiles());
            return new DeploymentStatus(DeploymentStatus.DEPLOYED, details);
        } catch (IOException e) {
            log.warn("[Deploy] Manifest of {} is unreadable", deploymentId, e);
            return new DeploymentStatus(DeploymentStatus.NOT_FOUND, null);
        }
    }

    /** Every readable deployment under the root; the directory name is the deployment id. */
    public List<DeploymentManifest> listDeployments() {
        List<DeploymentManifest> deployments = new ArrayList<>();
        try {
            Files.createDirectories(root);
            try (Stream<Path> entries = Files.list(root)) {
                for (Path dir : entries.filter(Files::isDirectory).sorted().toList()) {
                    Path manifestPath = dir.resolve(MANIFEST);
                    if (!Files.isRegularFile(manifestPath)) continue;
                    try {
                        DeploymentManifest manifest = mapper.readValue(manifestPath.toFile(), DeploymentManifest.class);
                        manifest.setDeploymentId(dir.getFileName().toString());
                        deployments.add(manifest);
                    } catch (IOException e) {
                        log.debug("[Deploy] Skipping {}: unreadable manifest ({})", dir.getFileName(), e.getMessage());
                    }
                }
            }
        } catch (IOException e) {
            log.error("[Deploy] Failed to list deployments under {}", root, e);
        }
        return deployments;
    }

    // ── Writing ───────────────────────────────────────────────────────────────

    // Ids are {flowId}-{millis}; a directory that already exists gets a numeric suffix instead of being reused
    private Path claimDirectory(Flow flow) throws IOException {
        Files.createDirectories(root);
        String base = flow.getId() + "-" + clock.millis();
        for (int attempt = 0; attempt < MAX_ID_ATTEMPTS; attempt++) {
            String candidate = attempt == 0 ? base : base + "-" + attempt;
            try {
                return Files.createDirectory(root.resolve(candidate));
            } catch (FileAlreadyExistsException e) {
                log.debug("[Deploy] Deployment id {} is taken, trying the next one", candidate);
            }
        }
        throw new IOException("No free deployment id for flow " + flow.getId());
    }

    private void writeGeneratedFiles(Path dir, Flow flow, DeploymentConfig config) throws IOException {
        FlowType type = flow.getType();
        Map<String, String> files = new LinkedHashMap<>();

        switch (type) {
            case CRUD, API -> {
                files.put("src/module.ts", flow.getGeneratedCode());
                files.put("src/index.ts", moduleIndex(type));
            }
            case FORM, DASHBOARD -> {
                files.put("src/component.tsx", flow.getGeneratedCode());
                files.put("src/index.ts", "export { default } from './component';");
            }
            case WORKFLOW -> {
                files.put("src/workflow.ts", flow.getGeneratedCode());
                files.put("src/index.ts", "export { GeneratedWorkflow as default } from './workflow';");
            }
            default -> {
                files.put("src/generated.ts", flow.getGeneratedCode());
                files.put("src/index.ts", "export * from './generated';");
            }
        }
        files.put("tsconfig.json", mapper.writerWithDefaultPrettyPrinter().writeValueAsString(tsconfig()));

        if (type == FlowType.API || type == FlowType.CRUD) {
            files.put("package.json", mapper.writerWithDefaultPrettyPrinter().writeValueAsString(packageJson(flow)));
        }
        if (config != null && config.isContainerized()) {
            files.put("Dockerfile", DOCKERFILE);
            files.put(".dockerignore", DOCKERIGNORE);
        }

        for (Map.Entry<String, String> file : files.entrySet()) {
            Path target = dir.resolve(file.getKey());
            Files.createDirectories(target.getParent());
            Files.writeString(target, file.getValue(), StandardCharsets.UTF_8);
        }
    }

    // The file list is taken before the manifest itself is written
    private void writeManifest(Path dir, Flow flow, String deploymentId) throws IOException {
        Map<String, Object> config = flow.getConfig() != null ? flow.getConfig() : Map.of();
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("generatedAt", config.get("generatedAt"));
        metadata.put("prompt", flow.getPrompt());
        metadata.put("tags", flow.getTags());

        DeploymentManifest manifest = DeploymentManifest.builder()
                .deploymentId(deploymentId)
                .flowId(flow.getId().toString())
                .flowName(flow.getName())
                .flowType(flow.getType().name())
                .version("1.0.0")
                .deployedAt(Instant.now().toString())
                .status(DeploymentStatus.DEPLOYED)
                .files(listFiles(dir))
                .config(config)
                .metadata(metadata)
                .build();
        Files.writeString(dir.resolve(MANIFEST),
                mapper.writerWithDefaultPrettyPrinter().writeValueAsString(manifest), StandardCharsets.UTF_8);
    }

    private List<String> validateDeployment(Path dir) {
        List<String> errors = new ArrayList<>();
        for (String file : REQUIRED_FILES) {
            if (!Files.exists(dir.resolve(file))) {
                errors.add("Required file missing: " + file);
            }
        }

        Path packagePath = dir.resolve("package.json");
        if (Files.exists(packagePath)) {
            try {
                JsonNode pkg = mapper.readTree(packagePath.toFile());
                if (!pkg.hasNonNull("name") || !pkg.hasNonNull("version")) {
                    errors.add("Invalid package.json: missing name or version");
                }
            } catch (IOException e) {
                errors.add("Invalid package.json: " + e.getMessage());
            }
        } else {
            errors.add("Invalid package.json: file not found");
        }

        Path src = dir.resolve("src");
        if (!Files.isDirectory(src)) {
            errors.add("Source directory not found");
        } else {
            try (Stream<Path> srcFiles = Files.list(src)) {
                if (srcFiles.findAny().isEmpty()) {
                    errors.add("No source files found in src directory");
                }
            } catch (IOException e) {
                errors.add("Source directory not readable: " + e.getMessage());
            }
        }
        return errors;
    }

    private List<String> listFiles(Path dir) throws IOException {
        try (Stream<Path> walk = Files.walk(dir)) {
            return walk.filter(Files::isRegularFile)
                    .map(p -> dir.relativize(p).toString().replace('\\', '/'))
                    .sorted()
                    .toList();
        }
    }

    private static String moduleIndex(FlowType type) {
        if (type == FlowType.CRUD) {
            return """
                    import { Module } from '@nestjs/common';
                    import { GeneratedController, GeneratedService } from './module';

                    @Module({
                      controllers: [GeneratedController],
                      providers: [GeneratedService],
                      exports: [GeneratedService],
                    })
                    export class GeneratedModule {}

                    export * from './module';
                    """;
        }
        return """
                import { Module } from '@nestjs/common';
                import { GeneratedApiController } from './module';

                @Module({
                  controllers: [GeneratedApiController],
                })
                export class GeneratedApiModule {}

                export * from './module';
                """;
    }

    private static Map<String, Object> tsconfig() {
        Map<String, Object> compilerOptions = new LinkedHashMap<>();
        compilerOptions.put("target", "ES2020");
        compilerOptions.put("module", "commonjs");
        compilerOptions.put("lib", List.of("ES2020"));
        compilerOptions.put("outDir", "./dist");
        compilerOptions.put("rootDir", "./src");
        compilerOptions.put("strict", true);
        compilerOptions.put("esModuleInterop", true);
        compilerOptions.put("skipLibCheck", true);
        compilerOptions.put("forceConsistentCasingInFileNames", true);
        compilerOptions.put("experimentalDecorators", true);
        compilerOptions.put("emitDecoratorMetadata", true);

        Map<String, Object> tsconfig = new LinkedHashMap<>();
        tsconfig.put("compilerOptions", compilerOptions);
        tsconfig.put("include", List.of("src/**/*"));
        tsconfig.put("exclude", List.of("node_modules", "dist"));
        return tsconfig;
    }

    private static Map<String, Object> packageJson(Flow flow) {
        Map<String, Object> pkg = new LinkedHashMap<>();
        pkg.put("name", "generated-module-" + flow.getId());
        pkg.put("version", "1.0.0");
        pkg.put("description", "Generated module: " + flow.getName());
        pkg.put("main", "dist/index.js");
        pkg.put("types", "dist/index.d.ts");
        pkg.put("scripts", Map.of(
                "build", "tsc",
                "start", "node dist/index.js",
                "dev", "ts-node src/index.ts",
                "test", "jest"));
        pkg.put("dependencies", Map.of(
                "@nestjs/common", "^10.0.0",
                "@nestjs/core", "^10.0.0",
                "@nestjs/platform-express", "^10.0.0",
                "reflect-metadata", "^0.1.13",
                "rxjs", "^7.8.0"));
        pkg.put("devDependencies", Map.of(
                "@types/node", "^20.0.0",
                "typescript", "^5.0.0",
                "ts-node", "^10.9.0",
                "jest", "^29.0.0",
                "@types/jest", "^29.0.0"));
        pkg.put("keywords", List.of("generated", "siat"));
        pkg.put("author", "SIAT Generator");
        pkg.put("license", "MIT");
        return pkg;
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private DeploymentResult failed(Flow flow, String reason) {
        log.warn("[Deploy] Deployment of flow {} failed: {}", flow.getId(), reason);
        return DeploymentResult.failure("Deployment failed: " + reason);
    }

    // Deployment ids never contain path separators; anything else is treated as unknown
    private Path resolveDeployment(String deploymentId) {
        if (deploymentId == null || deploymentId.isBlank()
                || deploymentId.contains("/") || deploymentId.contains("\\") || deploymentId.contains("..")) {
            return null;
        }
        return root.resolve(deploymentId);
    }

    private void removeQuietly(Path dir) {
        try {
            deleteRecursively(dir);
        } catch (IOException | UncheckedIOException e) {
            log.warn("[Deploy] Could not remove failed deployment directory {}", dir, e);
        }
    }

    private static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) return;
        try (Stream<Path> walk = Files.walk(dir)) {
            for (Path p : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.delete(p);
            }
        }
    }

    private static final String DOCKERFILE = """
            FROM node:18-alpine

            WORKDIR /app

            COPY package*.json ./
            RUN npm ci --only=production

            COPY dist ./dist

            EXPOSE 3000

            CMD ["npm", "start"]
            """;

    private static final String DOCKERIGNORE = """
            node_modules
            npm-debug.log
            .git
            .gitignore
            README.md
            .env
            .nyc_output
            coverage
            src
            tsconfig.json
            """;
}
