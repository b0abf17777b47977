package com.siat.siat_backend.generator;

import com.siat.siat_backend.model.domain.FlowType;
import com.siat.siat_backend.model.flow.FlowStep;
import com.siat.siat_backend.model.flow.StepCondition;
import com.siat.siat_backend.model.generation.ModuleRequirements;
import com.siat.siat_backend.model.generation.ScaffoldedModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders a TypeScript module skeleton for each flow type from parsed requirements, and the
 * default step list a new flow starts with.
 */
@Slf4j
@Component
public class ModuleScaffolder {

    public ScaffoldedModule scaffold(FlowType type, ModuleRequirements req) {
        log.debug("Scaffolding {} module", type);
        return switch (type) {
            case CRUD -> crud(req);
            case API -> api(req);
            case FORM -> form(req);
            case DASHBOARD -> dashboard(req);
            case WORKFLOW -> workflow(req);
            case REPORT -> report(req);
            default -> generic(req);
        };
    }

    public List<FlowStep> flowStructure(FlowType type, ModuleRequirements req) {
        List<FlowStep> steps = new ArrayList<>();

        steps.add(step("start", "Start", "start",
                mapOf("initialVariables", new LinkedHashMap<>()), List.of("input")));

        steps.add(step("input", "Input Validation", "transform",
                mapOf("transformCode", "result = input;",
                        "inputMapping", mapOf("data", "input"),
                        "outputMapping", mapOf("validatedData", "result")),
                List.of("process")));

        if (type == FlowType.CRUD) {
            steps.add(step("process", "CRUD Operation", "database",
                    mapOf("operation", first(req.getOperations(), "create"),
                            "entity", first(req.getEntities(), "record")),
                    List.of("output")));
        } else if (type == FlowType.WORKFLOW) {
            FlowStep decision = step("process", "Workflow Logic", "condition",
                    mapOf("condition", "variables.validatedData !== null"),
                    List.of("transform", "error"));
            decision.setConditions(List.of(
                    new StepCondition("variables.validatedData !== null", "transform"),
                    new StepCondition("variables.validatedData === null", "error")));
            steps.add(decision);
            steps.add(step("transform", "Data Transformation", "transform",
                    mapOf("transformCode", "result = { processed: true, data: input };"), List.of("output")));
            steps.add(step("error", "Error Handling", "output",
                    mapOf("outputMapping", mapOf("error", "Invalid input data")), List.of()));
        } else {
            steps.add(step("process", "Process Data", "transform",
                    mapOf("transformCode", "result = { processed: true, ...input };"), List.of("output")));
        }

        steps.add(step("output", "Output", "output",
                mapOf("outputMapping", mapOf("result", "variables.processedData")), List.of()));
        return steps;
    }

    // ── Scaffolds ─────────────────────────────────────────────────────────────

    private ScaffoldedModule crud(ModuleRequirements req) {
        String entity = first(req.getEntities(), "item");
        String cap = capitalize(entity);
        String createFields = req.getFields().stream().map(f -> "  " + f + ": string;").collect(Collectors.joining("\n"));
        String updateFields = req.getFields().stream().map(f -> "  " + f + "?: string;").collect(Collectors.joining("\n"));

        String code = CodeTemplates.substitute(CRUD_TEMPLATE, Map.of(
                "entity", entity, "Entity", cap,
                "createFields", createFields, "updateFields", updateFields));

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("entity", entity);
        config.put("fields", req.getFields());
        config.put("operations", List.of("create", "read", "update", "delete"));
        config.put("validations", req.getValidations());
        return new ScaffoldedModule(code, config);
    }

    private ScaffoldedModule api(ModuleRequirements req) {
        String endpoints = req.getOperations().stream().map(op -> """

                  @%s('/%s')
                  @ApiOperation({ summary: '%s operation' })
                  async %s(@Body() data?: any, @Param() params?: any) {
                    return { success: true, operation: '%s', data };
                  }""".formatted("create".equals(op) ? "Post" : "Get", op, capitalize(op), op, op))
                .collect(Collectors.joining("\n"));

        String code = CodeTemplates.substitute(API_TEMPLATE, Map.of("endpoints", endpoints));

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("operations", req.getOperations());
        config.put("endpoints", req.getOperations().stream().map(op -> "/" + op).collect(Collectors.toList()));
        return new ScaffoldedModule(code, config);
    }

    private ScaffoldedModule form(ModuleRequirements req) {
        boolean required = req.getValidations().contains("required");
        boolean email = req.getValidations().contains("email");
        String fields = req.getFields().stream().map(f -> {
            StringBuilder rules = new StringBuilder();
            if (email && f.contains("email")) rules.append(" email: true,");
            if (required) rules.append(" required: true,");
            return """
                        {
                          name: '%s',
                          type: '%s',
                          label: '%s',
                          required: %s,
                          validation: {%s }
                        }""".formatted(f, fieldType(f), capitalize(f), required, rules);
        }).collect(Collectors.joining(",\n"));
        String validation = req.getValidations().stream().map(v -> v + ": true").collect(Collectors.joining(",\n    "));

        String code = CodeTemplates.substitute(FORM_TEMPLATE, Map.of("fields", fields, "validation", validation));

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("fields", req.getFields());
        config.put("validations", req.getValidations());
        config.put("ui_components", req.getUiComponents());
        return new ScaffoldedModule(code, config);
    }

    private ScaffoldedModule dashboard(ModuleRequirements req) {
        StringBuilder widgets = new StringBuilder();
        if (req.getUiComponents().contains("chart")) {
            widgets.append("""
                        {
                          type: 'chart',
                          title: 'Overview',
                          config: { type: 'line', rows: [] }
                        },
                    """);
        }
        if (req.getUiComponents().contains("table")) {
            String columns = req.getFields().stream().map(f -> "'" + f + "'").collect(Collectors.joining(", "));
            widgets.append("""
                        {
                          type: 'table',
                          title: 'Records',
                          config: { columns: [%s], rows: [] }
                        },
                    """.formatted(columns));
        }

        String code = CodeTemplates.substitute(DASHBOARD_TEMPLATE, Map.of("widgets", widgets.toString()));

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("widgets", List.of("chart", "table", "metric"));
        config.put("layout", "grid");
        config.put("refresh_interval", 30000);
        return new ScaffoldedModule(code, config);
    }

    private ScaffoldedModule workflow(ModuleRequirements req) {
        String code = CodeTemplates.substitute(WORKFLOW_TEMPLATE, Map.of(
                "rules", quotedList(req.getValidations()),
                "operations", quotedList(req.getOperations())));

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("steps", List.of("start", "validation", "process", "complete"));
        config.put("operations", req.getOperations());
        config.put("validations", req.getValidations());
        return new ScaffoldedModule(code, config);
    }

    private ScaffoldedModule report(ModuleRequirements req) {
        String filters = req.getFields().stream()
                .map(f -> "{ field: '" + f + "', type: '" + fieldType(f) + "' }")
                .collect(Collectors.joining(",\n      "));

        String code = CodeTemplates.substitute(REPORT_TEMPLATE, Map.of(
                "fields", quotedList(req.getFields()),
                "filters", filters,
                "groupBy", first(req.getFields(), "category"),
                "sortBy", first(req.getFields(), "date")));

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("fields", req.getFields());
        config.put("formats", List.of("pdf", "excel", "csv"));
        config.put("filters", req.getFields());
        return new ScaffoldedModule(code, config);
    }

    private ScaffoldedModule generic(ModuleRequirements req) {
        String checks = req.getValidations().stream().map(v -> """

                    if (!this.validate%s(input)) {
                      errors.push('%s validation failed');
                    }""".formatted(capitalize(v), v)).collect(Collectors.joining());
        String validators = req.getValidations().stream().map(v -> """

                  private validate%s(input: any): boolean {
                    return true;
                  }""".formatted(capitalize(v))).collect(Collectors.joining("\n"));

        String code = CodeTemplates.substitute(GENERIC_TEMPLATE, Map.of(
                "operations", quotedList(req.getOperations()),
                "entities", quotedList(req.getEntities()),
                "checks", checks,
                "validators", validators));

        Map<String, Object> config = new LinkedHashMap<>();
        config.put("type", "generic");
        config.put("operations", req.getOperations());
        config.put("entities", req.getEntities());
        config.put("validations", req.getValidations());
        return new ScaffoldedModule(code, config);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    static String fieldType(String field) {
        if (field.contains("email")) return "email";
        if (field.contains("phone")) return "tel";
        if (field.contains("date")) return "date";
        if (field.contains("time")) return "time";
        if (field.contains("number") || field.contains("amount") || field.contains("price")) return "number";
        if (field.contains("password")) return "password";
        return "text";
    }

    static String capitalize(String s) {
        if (s == null || s.isEmpty()) return s;
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }

    private static String first(List<String> values, String fallback) {
        return values.isEmpty() ? fallback : values.get(0);
    }

    private static String quotedList(List<String> values) {
        return values.stream().map(v -> "'" + v + "'").collect(Collectors.joining(", "));
    }

    private static FlowStep step(String id, String name, String type, Map<String, Object> config, List<String> next) {
        return FlowStep.builder()
                .id(id)
                .name(name)
                .type(type)
                .config(config)
                .nextSteps(new ArrayList<>(next))
                .build();
    }

    private static Map<String, Object> mapOf(Object... kv) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            map.put((String) kv[i], kv[i + 1]);
        }
        return map;
    }

    private static final String CRUD_TEMPLATE = """
            // Generated CRUD module for {{Entity}}
            import { Injectable, NotFoundException, Controller, Get, Post, Put, Delete, Body, Param } from '@nestjs/common';
            import { PrismaService } from '../prisma/prisma.service';

            export class Create{{Entity}}Dto {
            {{createFields}}
            }

            export class Update{{Entity}}Dto {
            {{updateFields}}
            }

            @Injectable()
            export class {{Entity}}Service {
              constructor(private readonly prisma: PrismaService) {}

              async create(input: Create{{Entity}}Dto) {
                return this.prisma.{{entity}}.create({ data: input });
              }

              async findAll() {
                return this.prisma.{{entity}}.findMany();
              }

              async findOne(id: string) {
                const {{entity}} = await this.prisma.{{entity}}.findUnique({ where: { id } });
                if (!{{entity}}) {
                  throw new NotFoundException('{{Entity}} not found');
                }
                return {{entity}};
              }

              async update(id: string, input: Update{{Entity}}Dto) {
                await this.findOne(id);
                return this.prisma.{{entity}}.update({ where: { id }, data: input });
              }

              async remove(id: string) {
                await this.findOne(id);
                return this.prisma.{{entity}}.delete({ where: { id } });
              }
            }

            @Controller('{{entity}}s')
            export class {{Entity}}Controller {
              constructor(private readonly {{entity}}Service: {{Entity}}Service) {}

              @Post()
              create(@Body() input: Create{{Entity}}Dto) {
                return this.{{entity}}Service.create(input);
              }

              @Get()
              findAll() {
                return this.{{entity}}Service.findAll();
              }

              @Get(':id')
              findOne(@Param('id') id: string) {
                return this.{{entity}}Service.findOne(id);
              }

              @Put(':id')
              update(@Param('id') id: string, @Body() input: Update{{Entity}}Dto) {
                return this.{{entity}}Service.update(id, input);
              }

              @Delete(':id')
              remove(@Param('id') id: string) {
                return this.{{entity}}Service.remove(id);
              }
            }
            """;

    private static final String API_TEMPLATE = """
            // Generated API module
            import { Controller, Get, Post, Body, Param } from '@nestjs/common';
            import { ApiTags, ApiOperation } from '@nestjs/swagger';

            @ApiTags('Generated API')
            @Controller('api/generated')
            export class GeneratedApiController {{{endpoints}}
            }
            """;

    private static final String FORM_TEMPLATE = """
            // Generated form component
            export const GeneratedForm = {
              fields: [
            {{fields}}
              ],

              onSubmit: async (values) => {
                return { success: true, values };
              },

              validation: {
                {{validation}}
              }
            };
            """;

    private static final String DASHBOARD_TEMPLATE = """
            // Generated dashboard component
            export const GeneratedDashboard = {
              widgets: [
            {{widgets}}    {
                  type: 'metric',
                  title: 'Key Metrics',
                  config: {
                    metrics: [
                      { label: 'Total Records', value: 0 },
                      { label: 'Active Items', value: 0 },
                    ]
                  }
                }
              ],

              layout: {
                columns: 2,
                responsive: true,
              },

              refresh: async () => {
                return { success: true };
              }
            };
            """;

    private static final String WORKFLOW_TEMPLATE = """
            // Generated workflow module
            export class GeneratedWorkflow {
              steps = [
                { id: 'start', name: 'Start Process', type: 'start', nextSteps: ['validation'] },
                { id: 'validation', name: 'Validate Input', type: 'validation', config: { rules: [{{rules}}] }, nextSteps: ['process'] },
                { id: 'process', name: 'Process', type: 'process', config: { operations: [{{operations}}] }, nextSteps: ['complete'] },
                { id: 'complete', name: 'Complete', type: 'end', nextSteps: [] }
              ];

              async execute(input: any) {
                const context = { input, variables: {} };
                let current = this.steps[0];
                while (current) {
                  await this.executeStep(current, context);
                  current = this.nextStep(current);
                }
                return context;
              }

              private async executeStep(step: any, context: any) {
                context.variables[step.id] = true;
              }

              private nextStep(current: any) {
                if (!current.nextSteps || current.nextSteps.length === 0) {
                  return;
                }
                return this.steps.find(s => s.id === current.nextSteps[0]);
              }
            }
            """;

    private static final String REPORT_TEMPLATE = """
            // Generated report module
            export class GeneratedReport {
              config = {
                title: 'Generated Report',
                fields: [{{fields}}],
                filters: [
                  {{filters}}
                ],
                groupBy: ['{{groupBy}}'],
                sortBy: ['{{sortBy}}'],
                format: 'table'
              };

              async generate(filters: any = {}) {
                const rows = await this.fetchRows(filters);
                return this.formatReport(rows);
              }

              private async fetchRows(filters: any) {
                return [];
              }

              private formatReport(rows: any[]) {
                return {
                  title: this.config.title,
                  rows,
                  summary: { totalRecords: rows.length, generatedAt: new Date() }
                };
              }

              async export(format: 'pdf' | 'excel' | 'csv' = 'pdf') {
                const report = await this.generate();
                return { success: true, format, report };
              }
            }
            """;

    private static final String GENERIC_TEMPLATE = """
            // Generated module
            export class GeneratedModule {
              async process(input: any) {
                return {
                  input,
                  processed: true,
                  timestamp: new Date(),
                  operations: [{{operations}}],
                  entities: [{{entities}}]
                };
              }

              validate(input: any) {
                const errors = [];{{checks}}
                return { isValid: errors.length === 0, errors };
              }
            {{validators}}
            }
            """;
}
