package com.qualitylens.core.principle.impl;

import com.qualitylens.core.model.Principle;
import com.qualitylens.core.model.Violation;
import com.qualitylens.core.model.ViolationSeverity;
import com.qualitylens.core.principle.PrincipleTestBase;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DependencyInversionChecker}.
 */
class DependencyInversionCheckerTest extends PrincipleTestBase {

    private final DependencyInversionChecker checker = new DependencyInversionChecker();

    @Test
    void check_classConstructingCollaborators_reportsConcreteDependencies() {
        // Given
        String content = """
            class OrderService {
              constructor() {
                this.repo = new OrderRepository();
                this.mailer = new SmtpMailer();
                this.cache = new Map();
                this.created = new Date();
                this.client = new HttpClient({ retries: 3 });
                this.audit = new AuditLog();
              }
            }
            """;

        // When
        List<Violation> violations = checker.check(context("orders.js", content));

        // Then
        assertThat(violations).singleElement().satisfies(violation -> {
            assertThat(violation.principle()).isEqualTo(Principle.DEPENDENCY_INVERSION);
            assertThat(violation.severity()).isEqualTo(ViolationSeverity.MEDIUM);
            assertThat(violation.className()).isEqualTo("OrderService");
            assertThat(violation.metrics().dependencyCount()).isEqualTo(4);
            assertThat(violation.description())
                .contains("AuditLog, HttpClient, OrderRepository, SmtpMailer");
        });
    }

    @Test
    void check_fewCollaborators_reportsNothing() {
        String content = """
            class Clock {
              now() {
                return new Date(new TimeSource().read());
              }
            }
            """;

        assertThat(checker.check(context("clock.js", content))).isEmpty();
    }

    @Test
    void concreteTypes_ignoresBuiltInsErrorsAndLowercaseCalls() {
        String masked = "throw new ValidationError(); new Foo<Bar>(); new lower(); new Promise(r); new Foo();";

        assertThat(DependencyInversionChecker.concreteTypes(masked)).containsExactly("Foo");
    }

    @Test
    void concreteTypes_inComments_areIgnored() {
        String content = """
            class Quiet {
              run() {
                // new A(); new B(); new C(); new D();
              }
            }
            """;

        assertThat(checker.check(context("quiet.js", content))).isEmpty();
    }
}
