package com.siat.siat_backend.generator;

import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fixed template library behind local generation: one canned snippet per language family
 * and one base template per module kind. Base templates use {{key}} placeholders.
 */
@Component
public class CodeTemplates {

    public static final String PLACEHOLDER = "// Generated code placeholder";

    private static final Pattern VAR_PATTERN = Pattern.compile("\\{\\{(\\w+)\\}\\}");

    private final Map<LanguageFamily, String> canned = new EnumMap<>(LanguageFamily.class);
    private final Map<ModuleKind, String> base = new EnumMap<>(ModuleKind.class);

    public CodeTemplates() {
        canned.put(LanguageFamily.SCRIPT, SCRIPT_PROCESSOR);
        canned.put(LanguageFamily.PYTHON, PYTHON_PROCESSOR);
        canned.put(LanguageFamily.SQL, SQL_ANALYTICS);
        canned.put(LanguageFamily.OTHER, GENERIC_PROCESSOR);

        base.put(ModuleKind.CONTROLLER, CONTROLLER_BASE);
        base.put(ModuleKind.SERVICE, SERVICE_BASE);
        base.put(ModuleKind.DTO, DTO_BASE);
        base.put(ModuleKind.ENTITY, ENTITY_BASE);
    }

    public String canned(LanguageFamily family) {
        return canned.get(family);
    }

    public boolean hasBaseTemplate(String type) {
        return ModuleKind.parse(type).map(base::containsKey).orElse(false);
    }

    /** Base template for the type with every known {{key}} substituted; unknown types get the placeholder. */
    public String renderBase(String type, Map<String, String> variables) {
        String template = ModuleKind.parse(type).map(base::get).orElse(null);
        if (template == null) return PLACEHOLDER;
        return substitute(template, variables);
    }

    static String substitute(String template, Map<String, String> variables) {
        Matcher m = VAR_PATTERN.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String value = variables.get(m.group(1));
            m.appendReplacement(sb, Matcher.quoteReplacement(value != null ? value : m.group()));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static final String SCRIPT_PROCESSOR = """
            class AdvancedProcessor {
              constructor(config = {}) {
                this.config = {
                  batchSize: 100,
                  timeout: 5000,
                  retries: 3,
                  ...config
                };
                this.cache = new Map();
              }

              async processWithRetry(data, operation) {
                let attempts = 0;

                while (attempts < this.config.retries) {
                  try {
                    return await this.executeOperation(data, operation);
                  } catch (error) {
                    attempts++;
                    if (attempts >= this.config.retries) throw error;
                    await this.delay(1000 * attempts);
                  }
                }
              }

              async executeOperation(data, operation) {
                const cacheKey = this.generateCacheKey(data, operation);

                if (this.cache.has(cacheKey)) {
                  return this.cache.get(cacheKey);
                }

                const result = await operation(data);
                this.cache.set(cacheKey, result);

                return result;
              }

              generateCacheKey(data, operation) {
                return `${JSON.stringify(data)}_${operation.name}`;
              }

              delay(ms) {
                return new Promise(resolve => setTimeout(resolve, ms));
              }
            }""";

    private static final String PYTHON_PROCESSOR = """
            import asyncio
            import logging
            from typing import List, Any, Optional
            from dataclasses import dataclass

            @dataclass
            class ProcessingConfig:
                batch_size: int = 100
                timeout: float = 5.0
                retries: int = 3
                enable_cache: bool = True

            class AdvancedProcessor:
                def __init__(self, config: Optional[ProcessingConfig] = None):
                    self.config = config or ProcessingConfig()
                    self.cache = {}
                    self.logger = logging.getLogger(__name__)

                async def process_with_retry(self, data: Any, operation: callable) -> Any:
                    \"""Process data with retry logic and error handling.\"""
                    attempts = 0

                    while attempts < self.config.retries:
                        try:
                            return await self.execute_operation(data, operation)
                        except Exception as e:
                            attempts += 1
                            if attempts >= self.config.retries:
                                self.logger.error(f"Operation failed after {attempts} attempts: {e}")
                                raise
                            await asyncio.sleep(1.0 * attempts)

                async def execute_operation(self, data: Any, operation: callable) -> Any:
                    \"""Execute operation with caching support.\"""
                    cache_key = f"{hash(str(data))}_{operation.__name__}"
                    if self.config.enable_cache and cache_key in self.cache:
                        return self.cache[cache_key]
                    result = await operation(data)
                    if self.config.enable_cache:
                        self.cache[cache_key] = result
                    return result

                async def process_batch(self, items: List[Any], operation: callable) -> List[Any]:
                    \"""Process items in batches.\"""
                    results = []
                    for i in range(0, len(items), self.config.batch_size):
                        batch = items[i:i + self.config.batch_size]
                        batch_results = await asyncio.gather(
                            *[self.process_with_retry(item, operation) for item in batch],
                            return_exceptions=True
                        )
                        results.extend(batch_results)
                    return results""";

    private static final String SQL_ANALYTICS = """
            -- Data processing query with CTEs and window functions
            WITH data_preparation AS (
                SELECT
                    id,
                    name,
                    category,
                    amount,
                    created_at,
                    ROW_NUMBER() OVER (PARTITION BY category ORDER BY amount DESC) as rank_in_category,
                    AVG(amount) OVER (PARTITION BY category ROWS BETWEEN 2 PRECEDING AND CURRENT ROW) as moving_avg
                FROM transactions
                WHERE created_at >= DATE_SUB(NOW(), INTERVAL 90 DAY)
            ),
            category_stats AS (
                SELECT
                    category,
                    COUNT(*) as total_transactions,
                    AVG(amount) as avg_amount,
                    STDDEV(amount) as amount_stddev
                FROM data_preparation
                GROUP BY category
            )
            SELECT
                dp.id,
                dp.name,
                dp.category,
                dp.amount,
                dp.rank_in_category,
                dp.moving_avg,
                cs.total_transactions,
                cs.avg_amount as category_avg,
                CASE
                    WHEN ABS(dp.amount - cs.avg_amount) > 2 * cs.amount_stddev THEN 'ANOMALY'
                    ELSE 'NORMAL'
                END as anomaly_flag
            FROM data_preparation dp
            JOIN category_stats cs ON dp.category = cs.category
            WHERE dp.rank_in_category <= 10
            ORDER BY dp.category, dp.rank_in_category;""";

    private static final String GENERIC_PROCESSOR = """
            // Generic code template
            class GenericProcessor {
              constructor(options = {}) {
                this.options = {
                  debug: false,
                  timeout: 30000,
                  ...options
                };
              }

              async process(input) {
                const startTime = Date.now();

                try {
                  this.log('Processing started');
                  const result = await this.executeWithTimeout(
                    () => this.performProcessing(input),
                    this.options.timeout
                  );
                  this.log(`Processing completed in ${Date.now() - startTime}ms`);
                  return result;
                } catch (error) {
                  this.log(`Processing failed: ${error.message}`);
                  throw error;
                }
              }

              async performProcessing(input) {
                return { processed: true, input, timestamp: new Date() };
              }

              async executeWithTimeout(operation, timeout) {
                return Promise.race([
                  operation(),
                  new Promise((_, reject) =>
                    setTimeout(() => reject(new Error('Operation timeout')), timeout)
                  )
                ]);
              }

              log(message) {
                if (this.options.debug) {
                  console.log(`[${new Date().toISOString()}] ${message}`);
                }
              }
            }""";

    private static final String CONTROLLER_BASE = """
            import { Controller, Get, Post, Body, Param, Put, Delete } from '@nestjs/common';
            import { ApiTags, ApiOperation, ApiResponse } from '@nestjs/swagger';

            @ApiTags('{{name}}')
            @Controller('{{path}}')
            export class {{className}}Controller {
              constructor(private readonly {{serviceName}}: {{ServiceClass}}) {}

              @Get()
              @ApiOperation({ summary: 'Get all {{entities}}' })
              @ApiResponse({ status: 200, description: 'List of {{entities}}' })
              async findAll() {
                return this.{{serviceName}}.findAll();
              }

              @Get(':id')
              @ApiOperation({ summary: 'Get {{entity}} by ID' })
              async findOne(@Param('id') id: string) {
                return this.{{serviceName}}.findOne(id);
              }

              @Post()
              @ApiOperation({ summary: 'Create new {{entity}}' })
              async create(@Body() createDto: Create{{EntityClass}}Dto) {
                return this.{{serviceName}}.create(createDto);
              }

              @Put(':id')
              @ApiOperation({ summary: 'Update {{entity}}' })
              async update(@Param('id') id: string, @Body() updateDto: Update{{EntityClass}}Dto) {
                return this.{{serviceName}}.update(id, updateDto);
              }

              @Delete(':id')
              @ApiOperation({ summary: 'Delete {{entity}}' })
              async remove(@Param('id') id: string) {
                return this.{{serviceName}}.remove(id);
              }
            }""";

    private static final String SERVICE_BASE = """
            import { Injectable, NotFoundException } from '@nestjs/common';
            import { PrismaService } from '../prisma/prisma.service';

            @Injectable()
            export class {{className}}Service {
              constructor(private prisma: PrismaService) {}

              async findAll() {
                return this.prisma.{{modelName}}.findMany({
                  where: { deletedAt: null }
                });
              }

              async findOne(id: string) {
                const {{entityName}} = await this.prisma.{{modelName}}.findUnique({
                  where: { id }
                });

                if (!{{entityName}}) {
                  throw new NotFoundException('{{EntityClass}} not found');
                }

                return {{entityName}};
              }

              async create(data: any) {
                return this.prisma.{{modelName}}.create({ data });
              }

              async update(id: string, data: any) {
                await this.findOne(id);
                return this.prisma.{{modelName}}.update({ where: { id }, data });
              }

              async remove(id: string) {
                await this.findOne(id);
                return this.prisma.{{modelName}}.update({
                  where: { id },
                  data: { deletedAt: new Date() }
                });
              }
            }""";

    private static final String DTO_BASE = """
            import { IsString, IsOptional } from 'class-validator';
            import { ApiProperty, ApiPropertyOptional } from '@nestjs/swagger';

            export class Create{{className}}Dto {
              @ApiProperty({ description: '{{description}}' })
              @IsString()
              name: string;

              @ApiPropertyOptional({ description: 'Optional description' })
              @IsOptional()
              @IsString()
              description?: string;
            }""";

    private static final String ENTITY_BASE = """
            export interface {{EntityClass}} {
              id: string;
              name: string;
              tenantId: string;
              createdAt: Date;
              updatedAt: Date;
              deletedAt?: Date;
            }""";
}
