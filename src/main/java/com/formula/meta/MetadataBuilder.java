package com.formula.meta;

import com.formula.ast.Argument;
import com.formula.ast.Family;
import com.formula.ast.FormulaAst;
import com.formula.ast.Grouping;
import com.formula.ast.GroupingVisitor;
import com.formula.ast.RandomEffect;
import com.formula.ast.RandomTerm;
import com.formula.ast.RandomTermVisitor;
import com.formula.ast.Response;
import com.formula.ast.Term;
import com.formula.ast.TermVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a parsed formula into a {@link FormulaMetaData} document.
 * <p>
 * Variables are numbered in order of first appearance; every response gets id 1.
 * A builder produces exactly one document and cannot be reused after {@link #build}.
 */
public final class MetadataBuilder {

    private static final Logger log = LoggerFactory.getLogger(MetadataBuilder.class);

    public static final int RESPONSE_ID = 1;

    private static final GroupingVisitor<String> GROUPING_NAME = new GroupingVisitor<>() {
        @Override
        public String visitSimple(Grouping.Simple grouping) {
            return grouping.name();
        }

        @Override
        public String visitGr(Grouping.Gr grouping) {
            return grouping.group();
        }

        @Override
        public String visitMm(Grouping.Mm grouping) {
            return String.join("_", grouping.groups());
        }

        @Override
        public String visitInteraction(Grouping.Interaction grouping) {
            return grouping.left() + ":" + grouping.right();
        }

        @Override
        public String visitNested(Grouping.Nested grouping) {
            return grouping.outer() + "/" + grouping.inner();
        }
    };

    private final Map<String, VariableState> variables = new LinkedHashMap<>();
    private final TermRegistrar termRegistrar = new TermRegistrar();
    private int nextId = RESPONSE_ID + 1;
    private int responseCount;
    private boolean randomEffectsModel;
    private boolean uncorrelatedSlopesAndIntercepts;
    private boolean built;

    /**
     * Build the document for a parsed formula in one go.
     */
    public static FormulaMetaData fromAst(String formula, FormulaAst ast) {
        MetadataBuilder builder = new MetadataBuilder();
        builder.pushResponse(ast.response());
        for (Term term : ast.terms()) {
            builder.pushTerm(term);
        }
        return builder.build(formula, ast.hasIntercept(), ast.family());
    }

    public void pushResponse(Response response) {
        checkNotBuilt();
        for (String name : response.names()) {
            VariableState state = variables.get(name);
            if (state == null) {
                state = new VariableState(name, RESPONSE_ID);
                state.generatedColumns.add(name);
                variables.put(name, state);
                responseCount++;
            }
            state.roles.add(VariableRole.RESPONSE);
        }
    }

    /**
     * Register one right-hand side term.
     */
    public void pushTerm(Term term) {
        checkNotBuilt();
        term.accept(termRegistrar);
    }

    public void pushPlainTerm(String name) {
        checkNotBuilt();
        VariableState state = ensure(name);
        state.roles.add(VariableRole.IDENTITY);
        state.roles.add(VariableRole.FIXED_EFFECT);
        if (!state.generatedColumns.contains(name)) {
            state.generatedColumns.add(0, name);
        }
    }

    public void pushFunctionTerm(String function, List<Argument> args) {
        checkNotBuilt();
        String base = TransformationRules.baseIdentifier(args);
        if (base == null) {
            log.debug("Skipping {}(...) without identifier argument", function);
            return;
        }
        VariableState state = ensure(base);
        state.roles.add(VariableRole.FIXED_EFFECT);
        if (TransformationRules.isCategorical(function)) {
            state.roles.add(VariableRole.CATEGORICAL);
        }
        addTransformation(state, TransformationRules.transformation(function, args, base));
    }

    /**
     * Register a fixed-effects interaction. Chained interactions are flattened
     * into one fact per distinct participant.
     */
    public void pushInteraction(Term.Interaction interaction) {
        checkNotBuilt();
        List<String> participants = new ArrayList<>();
        collectParticipants(interaction, participants);
        if (participants.size() < 2) {
            for (String name : participants) {
                ensure(name).roles.add(VariableRole.FIXED_EFFECT);
            }
            return;
        }

        int order = participants.size();
        for (String name : participants) {
            VariableState state = ensure(name);
            state.roles.add(VariableRole.FIXED_EFFECT);
            state.roles.add(VariableRole.INTERACTION_TERM);
            state.interactions.add(Interaction.fixed(others(participants, name), order));
        }

        String column = String.join("_", participants);
        VariableState first = variables.get(participants.get(0));
        if (!first.generatedColumns.contains(column)) {
            first.generatedColumns.add(column);
        }
    }

    public void pushRandomEffect(RandomEffect randomEffect) {
        checkNotBuilt();
        randomEffectsModel = true;

        Grouping grouping = randomEffect.grouping();
        boolean uncorrelated = randomEffect.isUncorrelated()
                || (grouping instanceof Grouping.Gr gr && !gr.correlated());
        if (uncorrelated) {
            uncorrelatedSlopesAndIntercepts = true;
        }

        String groupingVariable = grouping.accept(GROUPING_NAME);
        boolean hasIntercept = randomEffect.terms().stream()
                .noneMatch(t -> t instanceof RandomTerm.SuppressIntercept);

        RandomTermRegistrar registrar = new RandomTermRegistrar(groupingVariable, hasIntercept, !uncorrelated);
        for (RandomTerm term : randomEffect.terms()) {
            term.accept(registrar);
        }

        VariableState group = ensure(groupingVariable);
        group.roles.add(VariableRole.GROUPING_VARIABLE);
        group.randomEffects.add(RandomEffectInfo.grouping(groupingVariable, hasIntercept, !uncorrelated,
                registrar.interactions, registrar.slopes));
    }

    /**
     * Produce the document. The builder is consumed by this call.
     *
     * @param formula      Formula text echoed into the document
     * @param hasIntercept Whether the model keeps its intercept
     * @param family       Declared family, or null
     * @return Metadata document
     * @throws IllegalStateException when called twice
     */
    public FormulaMetaData build(String formula, boolean hasIntercept, Family family) {
        checkNotBuilt();
        built = true;

        List<VariableState> ordered = new ArrayList<>(variables.values());
        ordered.sort(Comparator.comparingInt(state -> state.id));

        Map<String, VariableInfo> columns = new LinkedHashMap<>();
        List<String> allColumns = new ArrayList<>();
        boolean interceptPlaced = false;
        for (VariableState state : ordered) {
            if (hasIntercept && !interceptPlaced && state.id != RESPONSE_ID) {
                allColumns.add(FormulaMetaData.INTERCEPT_COLUMN);
                interceptPlaced = true;
            }
            allColumns.addAll(state.generatedColumns);
            columns.put(state.name, state.toInfo());
        }
        if (hasIntercept && !interceptPlaced) {
            allColumns.add(FormulaMetaData.INTERCEPT_COLUMN);
        }

        Map<String, String> formulaOrder = new LinkedHashMap<>();
        for (int i = 0; i < allColumns.size(); i++) {
            formulaOrder.put(String.valueOf(i + 1), allColumns.get(i));
        }

        FormulaMetadataInfo info = new FormulaMetadataInfo(hasIntercept, randomEffectsModel,
                uncorrelatedSlopesAndIntercepts, family == null ? null : family.familyName(), responseCount);
        log.debug("Built metadata for '{}': {} variables, {} generated columns",
                formula, columns.size(), allColumns.size());
        return new FormulaMetaData(formula, info, columns, allColumns, formulaOrder);
    }

    private VariableState ensure(String name) {
        VariableState state = variables.get(name);
        if (state == null) {
            state = new VariableState(name, nextId++);
            state.generatedColumns.add(name);
            variables.put(name, state);
        }
        return state;
    }

    private void addTransformation(VariableState state, Transformation transformation) {
        state.transformations.add(transformation);
        if (!state.roles.contains(VariableRole.IDENTITY) && !state.roles.contains(VariableRole.RESPONSE)) {
            state.generatedColumns.remove(state.name);
        }
        for (String column : transformation.generatesColumns()) {
            if (!state.generatedColumns.contains(column)) {
                state.generatedColumns.add(column);
            }
        }
    }

    private void checkNotBuilt() {
        if (built) {
            throw new IllegalStateException("MetadataBuilder has already produced its document");
        }
    }

    private static void collectParticipants(Term term, List<String> out) {
        if (term instanceof Term.Column column) {
            addDistinct(out, column.name());
        } else if (term instanceof Term.Function function) {
            String base = TransformationRules.baseIdentifier(function.args());
            if (base != null) {
                addDistinct(out, base);
            }
        } else if (term instanceof Term.Interaction interaction) {
            collectParticipants(interaction.left(), out);
            collectParticipants(interaction.right(), out);
        }
    }

    private static void collectParticipants(RandomTerm term, List<String> out) {
        if (term instanceof RandomTerm.Column column) {
            addDistinct(out, column.name());
        } else if (term instanceof RandomTerm.Function function) {
            String base = TransformationRules.baseIdentifier(function.args());
            if (base != null) {
                addDistinct(out, base);
            }
        } else if (term instanceof RandomTerm.Interaction interaction) {
            collectParticipants(interaction.left(), out);
            collectParticipants(interaction.right(), out);
        }
    }

    private static void addDistinct(List<String> list, String value) {
        if (!list.contains(value)) {
            list.add(value);
        }
    }

    private static List<String> others(List<String> participants, String self) {
        List<String> result = new ArrayList<>(participants);
        result.remove(self);
        return result;
    }

    private final class TermRegistrar implements TermVisitor<Void> {
        @Override
        public Void visitColumn(Term.Column column) {
            pushPlainTerm(column.name());
            return null;
        }

        @Override
        public Void visitFunction(Term.Function function) {
            pushFunctionTerm(function.name(), function.args());
            return null;
        }

        @Override
        public Void visitInteraction(Term.Interaction interaction) {
            pushInteraction(interaction);
            return null;
        }

        @Override
        public Void visitRandomEffect(Term.RandomEffectTerm term) {
            pushRandomEffect(term.randomEffect());
            return null;
        }

        @Override
        public Void visitIntercept(Term.Intercept intercept) {
            return null;
        }

        @Override
        public Void visitZero(Term.Zero zero) {
            return null;
        }
    }

    /**
     * Registers the terms of one random-effects block and collects the block summary.
     */
    private final class RandomTermRegistrar implements RandomTermVisitor<Void> {
        private final String groupingVariable;
        private final boolean hasIntercept;
        private final boolean correlated;
        private final List<String> slopes = new ArrayList<>();
        private final List<String> interactions = new ArrayList<>();

        RandomTermRegistrar(String groupingVariable, boolean hasIntercept, boolean correlated) {
            this.groupingVariable = groupingVariable;
            this.hasIntercept = hasIntercept;
            this.correlated = correlated;
        }

        @Override
        public Void visitColumn(RandomTerm.Column column) {
            slope(ensure(column.name()));
            return null;
        }

        @Override
        public Void visitFunction(RandomTerm.Function function) {
            String base = TransformationRules.baseIdentifier(function.args());
            if (base == null) {
                log.debug("Random term {}(...) has no identifier argument", function.name());
                return null;
            }
            VariableState state = ensure(base);
            addTransformation(state, TransformationRules.transformation(function.name(), function.args(), base));
            slope(state);
            return null;
        }

        @Override
        public Void visitInteraction(RandomTerm.Interaction interaction) {
            List<String> participants = new ArrayList<>();
            collectParticipants(interaction, participants);
            if (participants.isEmpty()) {
                return null;
            }
            for (String name : participants) {
                VariableState state = ensure(name);
                state.roles.add(VariableRole.RANDOM_EFFECT);
                if (participants.size() > 1) {
                    state.interactions.add(Interaction.random(others(participants, name),
                            participants.size(), groupingVariable));
                }
            }
            addDistinct(interactions, String.join(":", participants));
            return null;
        }

        @Override
        public Void visitIntercept(RandomTerm.Intercept intercept) {
            return null;
        }

        @Override
        public Void visitSuppressIntercept(RandomTerm.SuppressIntercept suppress) {
            return null;
        }

        private void slope(VariableState state) {
            state.roles.add(VariableRole.RANDOM_EFFECT);
            state.randomEffects.add(RandomEffectInfo.slope(groupingVariable, hasIntercept, correlated));
            addDistinct(slopes, state.name);
        }
    }

    /**
     * Mutable per-variable registry, frozen into a {@link VariableInfo} on build.
     */
    private static final class VariableState {
        private final String name;
        private final int id;
        private final Set<VariableRole> roles = new LinkedHashSet<>();
        private final List<Transformation> transformations = new ArrayList<>();
        private final List<Interaction> interactions = new ArrayList<>();
        private final List<RandomEffectInfo> randomEffects = new ArrayList<>();
        private final List<String> generatedColumns = new ArrayList<>();

        VariableState(String name, int id) {
            this.name = name;
            this.id = id;
        }

        VariableInfo toInfo() {
            return new VariableInfo(id, roles, transformations, interactions, randomEffects, generatedColumns);
        }
    }
}
