package com.formula.meta;

import com.formula.ast.FormulaAst;
import com.formula.ast.Response;
import com.formula.lexer.FormulaTokenizer;
import com.formula.parser.FormulaParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MetadataBuilder.
 */
class MetadataBuilderTest {

    private static FormulaMetaData meta(String formula) {
        FormulaAst ast = new FormulaParser(formula, new FormulaTokenizer(formula).tokenize()).parse();
        return MetadataBuilder.fromAst(formula, ast);
    }

    private static List<VariableRole> roles(FormulaMetaData meta, String name) {
        return new ArrayList<>(meta.column(name).roles());
    }

    // ==================== Ids & Column Order ====================

    @Test
    @DisplayName("Should number variables and order generated columns")
    void shouldBuildPlainFormula() {
        FormulaMetaData meta = meta("y ~ x + z");

        assertEquals("y ~ x + z", meta.formula());
        assertEquals(List.of("y", "intercept", "x", "z"), meta.allGeneratedColumns());
        assertEquals(Map.of("1", "y", "2", "intercept", "3", "x", "4", "z"), meta.allGeneratedColumnsFormulaOrder());
        assertEquals(List.of("1", "2", "3", "4"), new ArrayList<>(meta.allGeneratedColumnsFormulaOrder().keySet()));
        assertEquals(1, meta.column("y").id());
        assertEquals(2, meta.column("x").id());
        assertEquals(3, meta.column("z").id());
        assertEquals(List.of(VariableRole.RESPONSE), roles(meta, "y"));
        assertEquals(List.of(VariableRole.IDENTITY, VariableRole.FIXED_EFFECT), roles(meta, "x"));

        FormulaMetadataInfo info = meta.metadata();
        assertTrue(info.hasIntercept());
        assertFalse(info.isRandomEffectsModel());
        assertFalse(info.hasUncorrelatedSlopesAndIntercepts());
        assertNull(info.family());
        assertEquals(1, info.responseVariableCount());
    }

    @Test
    @DisplayName("Removed intercept should not appear in generated columns")
    void shouldOmitIntercept() {
        FormulaMetaData meta = meta("y ~ x - 1");

        assertFalse(meta.metadata().hasIntercept());
        assertEquals(List.of("y", "x"), meta.allGeneratedColumns());
    }

    @Test
    @DisplayName("Intercept-only model should end with intercept column")
    void shouldBuildInterceptOnlyModel() {
        assertEquals(List.of("y", "intercept"), meta("y ~ 1").allGeneratedColumns());
        assertEquals(List.of("y"), meta("y ~ 0").allGeneratedColumns());
    }

    @Test
    @DisplayName("Ids should follow first appearance across fixed and random terms")
    void shouldNumberInOrderOfAppearance() {
        FormulaMetaData meta = meta("y ~ (x | group) + z + x");

        assertEquals(List.of("y", "x", "group", "z"), new ArrayList<>(meta.columns().keySet()));
        assertEquals(2, meta.column("x").id());
        assertEquals(3, meta.column("group").id());
        assertEquals(4, meta.column("z").id());
    }

    @Test
    @DisplayName("Every response of bind() should get id 1")
    void shouldBuildMultivariateResponse() {
        FormulaMetaData meta = meta("bind(y1, y2) ~ x");

        assertEquals(1, meta.column("y1").id());
        assertEquals(1, meta.column("y2").id());
        assertEquals(2, meta.column("x").id());
        assertEquals(2, meta.metadata().responseVariableCount());
        assertEquals(List.of("y1", "y2", "intercept", "x"), meta.allGeneratedColumns());
    }

    @Test
    @DisplayName("Family should be reported by lower-case name")
    void shouldReportFamily() {
        assertEquals("binomial", meta("y ~ x, family = binomial").metadata().family());
    }

    @Test
    @DisplayName("Family name should not depend on the default locale")
    void shouldReportFamilyUnderTurkishLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertEquals("binomial", meta("y ~ x, family = binomial").metadata().family());
            assertEquals("poisson", meta("y ~ x, family = poisson").metadata().family());
        } finally {
            Locale.setDefault(original);
        }
    }

    // ==================== Transformations ====================

    @Test
    @DisplayName("poly should generate one column per degree")
    void shouldBuildPoly() {
        FormulaMetaData meta = meta("y ~ poly(x, 2)");
        VariableInfo x = meta.column("x");

        assertEquals(List.of(new Transformation("poly", Map.of("degree", 2, "orthogonal", true),
                List.of("x_poly_1", "x_poly_2"))), x.transformations());
        assertEquals(List.of("x_poly_1", "x_poly_2"), x.generatedColumns());
        assertEquals(List.of(VariableRole.FIXED_EFFECT), roles(meta, "x"));
        assertEquals(List.of("y", "intercept", "x_poly_1", "x_poly_2"), meta.allGeneratedColumns());
    }

    @Test
    @DisplayName("Raw poly should not be orthogonal")
    void shouldBuildRawPoly() {
        Transformation poly = meta("y ~ poly(x, 3, raw = TRUE)").column("x").transformations().get(0);

        assertEquals(Map.of("degree", 3, "orthogonal", false), poly.parameters());
        assertEquals(List.of("x_poly_1", "x_poly_2", "x_poly_3"), poly.generatesColumns());
    }

    @Test
    @DisplayName("Plain term should keep bare column before transformed ones")
    void shouldKeepIdentityColumn() {
        assertEquals(List.of("x", "x_poly_1", "x_poly_2"),
                meta("y ~ x + poly(x, 2)").column("x").generatedColumns());
        assertEquals(List.of("x", "x_poly_1", "x_poly_2"),
                meta("y ~ poly(x, 2) + x").column("x").generatedColumns());
    }

    @Test
    @DisplayName("Transformations of one variable should accumulate")
    void shouldAccumulateTransformations() {
        VariableInfo x = meta("y ~ log(x) + poly(x, 2)").column("x");

        assertEquals(List.of("x_log", "x_poly_1", "x_poly_2"), x.generatedColumns());
        assertEquals(List.of("log", "poly"), x.transformations().stream().map(Transformation::function).toList());
        assertEquals(Map.of(), x.transformations().get(0).parameters());
    }

    @Test
    @DisplayName("Other functions should use positional parameters")
    void shouldBuildGenericFunction() {
        Transformation lag = meta("y ~ lag(x, 2)").column("x").transformations().get(0);

        assertEquals("lag", lag.function());
        assertEquals(Map.of("arg_0", "x", "arg_1", 2), lag.parameters());
        assertEquals(List.of("x_lag"), lag.generatesColumns());
    }

    @Test
    @DisplayName("Categorical functions should add Categorical role and ref")
    void shouldBuildCategorical() {
        FormulaMetaData meta = meta("y ~ c(treatment, ref = control) + factor(site)");

        assertEquals(List.of(VariableRole.FIXED_EFFECT, VariableRole.CATEGORICAL), roles(meta, "treatment"));
        assertEquals("control", meta.column("treatment").transformations().get(0).parameters().get("ref"));
        assertEquals(List.of("treatment_c"), meta.column("treatment").generatedColumns());
        assertTrue(meta.column("site").hasRole(VariableRole.CATEGORICAL));
    }

    @Test
    @DisplayName("Function without identifier argument should register nothing")
    void shouldSkipFunctionWithoutIdentifier() {
        FormulaMetaData meta = meta("y ~ f(2) + x");

        assertEquals(List.of("y", "x"), new ArrayList<>(meta.columns().keySet()));
        assertEquals(2, meta.column("x").id());
    }

    // ==================== Interactions ====================

    @Test
    @DisplayName("Two-way interaction should pair both sides")
    void shouldBuildTwoWayInteraction() {
        FormulaMetaData meta = meta("y ~ x:z");

        assertEquals(List.of(Interaction.fixed(List.of("z"), 2)), meta.column("x").interactions());
        assertEquals(List.of(Interaction.fixed(List.of("x"), 2)), meta.column("z").interactions());
        assertEquals(List.of("x", "x_z"), meta.column("x").generatedColumns());
        assertEquals(List.of("z"), meta.column("z").generatedColumns());
        assertTrue(meta.column("x").hasRole(VariableRole.INTERACTION_TERM));
        assertTrue(meta.column("z").hasRole(VariableRole.FIXED_EFFECT));
        assertEquals(List.of("y", "intercept", "x", "x_z", "z"), meta.allGeneratedColumns());
    }

    @Test
    @DisplayName("Three-way interaction should record every other participant")
    void shouldBuildThreeWayInteraction() {
        FormulaMetaData meta = meta("y ~ a*b*c1");

        Interaction a = meta.column("a").interactions().get(0);
        assertEquals(List.of("b", "c1"), a.with());
        assertEquals(3, a.order());
        assertEquals(Interaction.FIXED_EFFECTS, a.context());
        assertNull(a.groupingVariable());
        assertEquals(List.of("a", "c1"), meta.column("b").interactions().get(0).with());
        assertEquals(List.of("a", "a_b_c1"), meta.column("a").generatedColumns());
    }

    @Test
    @DisplayName("Interaction of a transformed variable should use its base identifier")
    void shouldResolveFunctionInInteraction() {
        FormulaMetaData meta = meta("y ~ log(x):z");

        assertEquals(List.of("z"), meta.column("x").interactions().get(0).with());
        assertEquals(List.of("x", "x_z"), meta.column("x").generatedColumns());
    }

    // ==================== Random Effects ====================

    @Test
    @DisplayName("Uncorrelated slope should mark model and grouping variable")
    void shouldBuildUncorrelatedSlope() {
        FormulaMetaData meta = meta("y ~ x + (x || group)");

        assertTrue(meta.metadata().isRandomEffectsModel());
        assertTrue(meta.metadata().hasUncorrelatedSlopesAndIntercepts());
        assertEquals(List.of(VariableRole.IDENTITY, VariableRole.FIXED_EFFECT, VariableRole.RANDOM_EFFECT),
                roles(meta, "x"));
        assertEquals(List.of(RandomEffectInfo.slope("group", true, false)), meta.column("x").randomEffects());

        VariableInfo group = meta.column("group");
        assertEquals(List.of(VariableRole.GROUPING_VARIABLE), new ArrayList<>(group.roles()));
        assertEquals(List.of(RandomEffectInfo.grouping("group", true, false, List.of(), List.of("x"))),
                group.randomEffects());
        assertEquals(List.of("y", "intercept", "x", "group"), meta.allGeneratedColumns());
    }

    @Test
    @DisplayName("Random intercept should be correlated by default")
    void shouldBuildRandomIntercept() {
        FormulaMetaData meta = meta("y ~ (1 | group)");
        RandomEffectInfo info = meta.column("group").randomEffects().get(0);

        assertEquals(RandomEffectInfo.GROUPING, info.kind());
        assertTrue(info.hasIntercept());
        assertTrue(info.correlated());
        assertEquals(List.of(), info.variables());
        assertFalse(meta.metadata().hasUncorrelatedSlopesAndIntercepts());
    }

    @Test
    @DisplayName("Suppressed intercept should be reported on slopes")
    void shouldReportSuppressedIntercept() {
        RandomEffectInfo slope = meta("y ~ (0 + x | group)").column("x").randomEffects().get(0);

        assertEquals(RandomEffectInfo.SLOPE, slope.kind());
        assertFalse(slope.hasIntercept());
        assertNull(slope.variables());
    }

    @Test
    @DisplayName("gr with cor = FALSE should be uncorrelated")
    void shouldTreatGrCorFalseAsUncorrelated() {
        FormulaMetaData meta = meta("y ~ (x | gr(g, cor = FALSE))");

        assertTrue(meta.metadata().hasUncorrelatedSlopesAndIntercepts());
        assertFalse(meta.column("g").randomEffects().get(0).correlated());
    }

    @Test
    @DisplayName("Uncorrelated flag should stick once set")
    void shouldKeepUncorrelatedFlag() {
        FormulaMetaData meta = meta("y ~ (x || g) + (1 | h)");

        assertTrue(meta.metadata().hasUncorrelatedSlopesAndIntercepts());
        assertTrue(meta.column("h").randomEffects().get(0).correlated());
    }

    @ParameterizedTest
    @DisplayName("Grouping variable name should follow grouping form")
    @CsvSource(delimiter = ';', value = {
            "y ~ (1 | g); g",
            "y ~ (1 | gr(g, id = \"a\")); g",
            "y ~ (1 | mm(s1, s2)); s1_s2",
            "y ~ (1 | a:b); a:b",
            "y ~ (1 | school/class); school/class"
    })
    void shouldNameGroupingVariable(String formula, String expected) {
        FormulaMetaData meta = meta(formula);

        assertTrue(meta.column(expected).hasRole(VariableRole.GROUPING_VARIABLE));
        assertEquals(expected, meta.column(expected).randomEffects().get(0).groupingVariable());
    }

    @Test
    @DisplayName("Random interaction should register participants with grouping context")
    void shouldBuildRandomInteraction() {
        FormulaMetaData meta = meta("y ~ (x:z | g)");

        assertEquals(List.of(VariableRole.RANDOM_EFFECT), roles(meta, "x"));
        assertEquals(List.of(Interaction.random(List.of("z"), 2, "g")), meta.column("x").interactions());
        assertEquals(List.of(Interaction.random(List.of("x"), 2, "g")), meta.column("z").interactions());

        RandomEffectInfo grouping = meta.column("g").randomEffects().get(0);
        assertEquals(List.of("x:z"), grouping.includesInteractions());
        assertEquals(List.of(), grouping.variables());
        assertEquals(List.of(2, 3, 4), List.of(meta.column("x").id(), meta.column("z").id(), meta.column("g").id()));
    }

    @Test
    @DisplayName("Transformed random slope should record its transformation")
    void shouldBuildTransformedSlope() {
        VariableInfo x = meta("y ~ (poly(x, 2) | g)").column("x");

        assertEquals("poly", x.transformations().get(0).function());
        assertEquals(List.of("x_poly_1", "x_poly_2"), x.generatedColumns());
        assertTrue(x.hasRole(VariableRole.RANDOM_EFFECT));
    }

    @Test
    @DisplayName("cs(1) should contribute no variable")
    void shouldIgnoreCsIntercept() {
        FormulaMetaData meta = meta("y ~ (cs(1) | g)");

        assertEquals(List.of("y", "g"), new ArrayList<>(meta.columns().keySet()));
    }

    // ==================== Invariants ====================

    @ParameterizedTest
    @DisplayName("Generated column count should equal per-variable columns plus intercept")
    @ValueSource(strings = {
            "y ~ x + z",
            "y ~ x - 1",
            "y ~ x + poly(x, 3) + log(z)",
            "y ~ a*b*c1 + (1 + a | g)",
            "bind(y1, y2) ~ x + (x || group), family = gaussian",
            "y ~ 0 + (0 + x | gr(g, cor = FALSE)) + c(f, ref = k)"
    })
    void shouldKeepColumnCountInvariant(String formula) {
        FormulaMetaData meta = meta(formula);
        int perVariable = meta.columns().values().stream().mapToInt(v -> v.generatedColumns().size()).sum();

        assertEquals(perVariable + (meta.metadata().hasIntercept() ? 1 : 0), meta.allGeneratedColumns().size());
        assertEquals(meta.allGeneratedColumns().size(), meta.allGeneratedColumnsFormulaOrder().size());
    }

    @Test
    @DisplayName("Building twice from the same formula should give equal documents")
    void shouldBeDeterministic() {
        String formula = "y ~ x + poly(x, 2) + (1 + x | p | group)";

        assertEquals(meta(formula), meta(formula));
    }

    @Test
    @DisplayName("Builder should be consumed by build")
    void shouldRejectReuse() {
        MetadataBuilder builder = new MetadataBuilder();
        builder.pushResponse(new Response.Single("y"));
        builder.pushPlainTerm("x");
        builder.build("y ~ x", true, null);

        assertThrows(IllegalStateException.class, () -> builder.build("y ~ x", true, null));
        assertThrows(IllegalStateException.class, () -> builder.pushPlainTerm("z"));
    }
}
