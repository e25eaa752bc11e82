package com.minizeries.parser;

import com.minizeries.parser.ast.SqlStatement;
import lombok.extern.slf4j.Slf4j;
import org.antlr.v4.runtime.*;
import org.antlr.v4.runtime.misc.ParseCancellationException;

/**
 * SQL 解析器入口
 *
 * 解析流程:
 * 1. 词法分析: SQL 字符串 → Token 流
 * 2. 语法分析: Token 流 → 解析树
 * 3. AST 构建: 解析树 → AST
 *
 * @author Mini-Zeries
 */
@Slf4j
public class SQLParser {

    /**
     * 解析 SQL 语句
     *
     * @param sql SQL 字符串
     * @return AST 根节点
     * @throws SQLParseException 解析失败时抛出
     */
    public SqlStatement parse(String sql) throws SQLParseException {
        try {
            log.info("Parsing SQL: {}", sql);

            CharStream input = CharStreams.fromString(sql);
            ZeriesSQLLexer lexer = new ZeriesSQLLexer(input);
            lexer.removeErrorListeners();
            lexer.addErrorListener(new ParseErrorListener());

            CommonTokenStream tokens = new CommonTokenStream(lexer);

            ZeriesSQLParser parser = new ZeriesSQLParser(tokens);
            parser.removeErrorListeners();
            parser.addErrorListener(new ParseErrorListener());

            ZeriesSQLParser.SqlStatementContext parseTree = parser.sqlStatement();

            ASTBuilder astBuilder = new ASTBuilder();
            SqlStatement ast = astBuilder.visitSqlStatement(parseTree);

            log.info("Parse successful: {}", ast.getStatementType());
            return ast;

        } catch (Exception e) {
            log.error("Parse failed: {}", e.getMessage());
            throw new SQLParseException("Failed to parse SQL: " + sql, e);
        }
    }

    /**
     * 错误监听器
     */
    private static class ParseErrorListener extends BaseErrorListener {
        @Override
        public void syntaxError(Recognizer<?, ?> recognizer,
                                Object offendingSymbol,
                                int line,
                                int charPositionInLine,
                                String msg,
                                RecognitionException e) {
            String error = String.format("Syntax error at line %d:%d - %s",
                    line, charPositionInLine, msg);
            throw new ParseCancellationException(error);
        }
    }

    /**
     * SQL 解析异常
     */
    public static class SQLParseException extends Exception {
        public SQLParseException(String message) {
            super(message);
        }

        public SQLParseException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
