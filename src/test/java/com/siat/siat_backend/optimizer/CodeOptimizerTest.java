package com.siat.siat_backend.optimizer;

import com.siat.siat_backend.validation.CodeValidator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CodeOptimizerTest {

    private final CodeOptimizer optimizer = new CodeOptimizer(new CodeValidator());

    @Test
    @DisplayName("returns the original when the rewrite fails structural validation")
    void returnsOriginalWhenRevalidationFails() {
        String code = "export class UserService {\n  var cache = {};\n  console.log('x');\n}";

        String result = optimizer.optimize(code, "service");

        assertThat(result).isSameAs(code);
    }

    @Test
    void returnsOriginalWhenSyntaxGateFails() {
        String code = "function broken() {\n  var a = 1;\n";

        assertThat(optimizer.optimize(code, "javascript")).isSameAs(code);
    }

    @Test
    void rewritesScript() {
        String code = "var x = 1;;\nconsole.log(x);\nfetch('http://a.io');";

        String result = optimizer.optimize(code, "javascript");

        assertThat(result).isEqualTo("const x = 1; fetch('https://a.io');");
    }

    @Test
    void normalizesSqlKeywordsAndDropsTautology() {
        String result = optimizer.optimize("select id from users where 1=1 and active = true", "sql");

        assertThat(result).isEqualTo("SELECT id FROM users WHERE active = true");
    }

    @Test
    void neutralizesUnsafeSinks() {
        String code = "const el = find();\nel.innerHTML = value;";

        String result = optimizer.optimize(code, "typescript");

        assertThat(result).contains("el.textContent = value;").doesNotContain("innerHTML");
    }

    @Test
    void nullStaysNull() {
        assertThat(optimizer.optimize(null, "javascript")).isNull();
    }
}
