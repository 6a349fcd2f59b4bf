package com.psiscript.compiler.parser;

import com.psiscript.compiler.ast.SourceLocation;
import com.psiscript.compiler.ast.Statement;
import com.psiscript.compiler.lexer.Lexer;
import com.psiscript.compiler.lexer.Token;
import com.psiscript.compiler.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

import static com.psiscript.compiler.lexer.TokenType.*;

/**
 * 语句树构建器（递归下降）
 *
 * <p>子句后紧跟 {@code {} 时打开子作用域，直到匹配的 {@code }}；
 * 子句后跟 {@code ;}、{@code }} 或输入结束时为叶子。空子句被丢弃。</p>
 */
public class StatementParser {

    private final String fileName;
    private final List<Token> tokens;
    private int pos = 0;

    public StatementParser(Lexer lexer) {
        this.fileName = lexer.getFileName();
        this.tokens = lexer.scanTokens();
    }

    /**
     * 解析整个源文件，返回顶层语句列表
     */
    public List<Statement> parse() {
        List<Statement> statements = parseBlock();
        if (!check(EOF)) {
            throw new ParseException("Unbalanced braces: unexpected '}'", current());
        }
        return statements;
    }

    // 解析到 '}' 或 EOF 为止（不消费结束符）
    private List<Statement> parseBlock() {
        List<Statement> statements = new ArrayList<>();
        while (!check(EOF) && !check(RBRACE)) {
            Token tok = advance();
            switch (tok.getType()) {
                case SEMICOLON:
                    // 空子句
                    break;
                case LBRACE:
                    // 无前导子句的裸块
                    statements.add(new Statement("", parseChildren(tok), locationOf(tok)));
                    break;
                case CLAUSE:
                    if (check(LBRACE)) {
                        Token open = advance();
                        statements.add(new Statement(tok.getLexeme(), parseChildren(open), locationOf(tok)));
                    } else {
                        statements.add(new Statement(tok.getLexeme(), locationOf(tok)));
                    }
                    break;
                default:
                    throw new ParseException("Unexpected token", tok);
            }
        }
        return statements;
    }

    private List<Statement> parseChildren(Token open) {
        List<Statement> children = parseBlock();
        if (!check(RBRACE)) {
            throw new ParseException("Unbalanced braces: block opened here is never closed", open, "'}'");
        }
        advance();
        return children;
    }

    // ============ 基础方法 ============

    private Token current() {
        return tokens.get(pos);
    }

    private Token advance() {
        Token tok = tokens.get(pos);
        if (!tok.is(EOF)) {
            pos++;
        }
        return tok;
    }

    private boolean check(TokenType type) {
        return current().is(type);
    }

    private SourceLocation locationOf(Token tok) {
        return new SourceLocation(fileName, tok.getLine(), tok.getColumn(), tok.getOffset());
    }
}
