package com.formula.core;

import com.formula.ast.FormulaAst;
import com.formula.config.FormulaConfig;
import com.formula.exception.FormulaParseException;
import com.formula.lexer.FormulaTokenizer;
import com.formula.lexer.Token;
import com.formula.meta.FormulaMetaData;
import com.formula.meta.MetadataBuilder;
import com.formula.parser.FormulaParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Default implementation of {@link FormulaEngine}.
 * Every call builds its own tokenizer, parser and metadata builder.
 */
public class DefaultFormulaEngine implements FormulaEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultFormulaEngine.class);

    private final FormulaConfig config;

    public DefaultFormulaEngine() {
        this(FormulaConfig.defaults());
    }

    public DefaultFormulaEngine(FormulaConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    @Override
    public FormulaMetaData parse(String formula) {
        List<Token> tokens = tokenize(formula);
        FormulaAst ast = new FormulaParser(formula, tokens).parse();
        log.debug("[{}] Parsed '{}' into {} terms", config.name(), formula, ast.terms().size());

        FormulaMetaData metaData = MetadataBuilder.fromAst(formula, ast);
        log.debug("[{}] '{}' has {} variables", config.name(), formula, metaData.columns().size());
        return metaData;
    }

    @Override
    public List<LexedToken> lex(String formula) {
        return tokenize(formula).stream()
                .map(LexedToken::of)
                .toList();
    }

    public FormulaConfig getConfig() {
        return config;
    }

    private List<Token> tokenize(String formula) {
        Objects.requireNonNull(formula, "formula");
        if (formula.length() > config.maxFormulaLength()) {
            throw FormulaParseException.syntax(0, "formula length " + formula.length()
                    + " exceeds the maximum of " + config.maxFormulaLength() + " characters");
        }

        List<Token> tokens = new FormulaTokenizer(formula).tokenize();
        log.debug("[{}] Lexed '{}' into {} tokens", config.name(), formula, tokens.size());
        if (config.traceTokens()) {
            for (int i = 0; i < tokens.size(); i++) {
                log.debug("[{}]   {}: {}", config.name(), i, tokens.get(i));
            }
        }
        return tokens;
    }
}
