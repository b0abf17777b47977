package com.siat.siat_backend.validation;

import com.siat.siat_backend.model.validation.CodeValidationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CodeValidatorTest {

    private final CodeValidator validator = new CodeValidator();

    @Test
    @DisplayName("controller becomes valid once @Controller is present")
    void controllerFlipsToValidWithDecorator() {
        String body = "export class UsersController {\n  @Get()\n  findAll() { return []; }\n}";

        CodeValidationResult before = validator.validateCode(body, "CONTROLLER");
        assertThat(before.isValid()).isFalse();
        assertThat(before.getErrors()).containsExactly("Controller must have @Controller decorator");

        CodeValidationResult after = validator.validateCode("@Controller('users')\n" + body, "CONTROLLER");
        assertThat(after.isValid()).isTrue();
        assertThat(after.getWarnings()).isEmpty();
    }

    @Test
    void controllerWithoutHttpMethodsOnlyWarns() {
        CodeValidationResult result = validator.validateCode("@Controller()\nexport class A {}", "controller");
        assertThat(result.isValid()).isTrue();
        assertThat(result.getWarnings()).containsExactly("Controller should have at least one HTTP method decorator");
    }

    @Test
    void emptyCodeIsInvalid() {
        CodeValidationResult result = validator.validateCode("   ", "SERVICE");
        assertThat(result.isValid()).isFalse();
        assertThat(result.getErrors()).containsExactly("Generated code is empty");
    }

    @Test
    void serviceRequiresInjectableAndExport() {
        CodeValidationResult result = validator.validateCode("class Foo {}", "SERVICE");
        assertThat(result.getErrors()).containsExactly(
                "Service must have @Injectable decorator",
                "Service must export a class");
    }

    @Test
    void entityAcceptsInterfaceOrClass() {
        assertThat(validator.validateCode("export interface User { id: string }", "ENTITY").isValid()).isTrue();
        assertThat(validator.validateCode("type User = {}", "ENTITY").isValid()).isFalse();
    }

    @Test
    void dtoWithoutDecoratorsWarns() {
        CodeValidationResult result = validator.validateCode("export class CreateUserDto { name: string; }", "DTO");
        assertThat(result.isValid()).isTrue();
        assertThat(result.getWarnings()).containsExactly("DTO should use validation decorators");
    }

    @Test
    void genericCodeWarnsOnTodo() {
        CodeValidationResult result = validator.validateCode("// TODO finish\nconst a = 1;", "javascript");
        assertThat(result.isValid()).isTrue();
        assertThat(result.getWarnings()).containsExactly("Code contains TODO or FIXME comments");
    }

    @Test
    void syntaxGateChecksBracketsForScripts() {
        assertThat(validator.passesSyntaxCheck("function a() { return [1, (2)]; }", "javascript")).isTrue();
        assertThat(validator.passesSyntaxCheck("function a() { return [1, 2); }", "typescript")).isFalse();
        assertThat(validator.passesSyntaxCheck("function a() {", "javascript")).isFalse();
    }

    @Test
    void syntaxGateForSqlNeedsFromWithSelect() {
        assertThat(validator.passesSyntaxCheck("SELECT id FROM users", "sql")).isTrue();
        assertThat(validator.passesSyntaxCheck("select 1", "sql")).isFalse();
        assertThat(validator.passesSyntaxCheck("UPDATE users SET a = 1", "sql")).isTrue();
    }

    @Test
    void syntaxGateRejectsNullLiteralsForOtherTypes() {
        assertThat(validator.passesSyntaxCheck("return null;", "CONTROLLER")).isFalse();
        assertThat(validator.passesSyntaxCheck("let x = undefined;", "CRUD")).isFalse();
        assertThat(validator.passesSyntaxCheck("", "CRUD")).isFalse();
        assertThat(validator.passesSyntaxCheck("anything at all", "python")).isTrue();
    }
}
