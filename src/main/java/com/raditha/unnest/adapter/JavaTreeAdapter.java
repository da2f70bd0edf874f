package com.raditha.unnest.adapter;

import com.github.javaparser.JavaParser;
import com.github.javaparser.JavaToken;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Position;
import com.github.javaparser.Problem;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.LocalClassDeclarationStmt;
import com.github.javaparser.ast.stmt.LocalRecordDeclarationStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.SynchronizedStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.raditha.unnest.model.Block;
import com.raditha.unnest.model.BlockKind;
import com.raditha.unnest.model.Dialect;

import java.util.List;
import java.util.Optional;

/**
 * Tree-based adapter for Java, built on the JavaParser syntax tree.
 * Node positions are converted to character offsets, so spans agree with the other adapters.
 */
public class JavaTreeAdapter implements DialectAdapter {

    private final JavaParser parser;

    public JavaTreeAdapter() {
        ParserConfiguration configuration = new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17)
                .setTabSize(1);
        this.parser = new JavaParser(configuration);
    }

    @Override
    public Dialect dialect() {
        return Dialect.JAVA;
    }

    @Override
    public Block index(String text) throws MalformedStructureException {
        LineIndex lines = new LineIndex(text);
        ParseResult<CompilationUnit> result = parser.parse(text);
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            throw toMalformed(result.getProblems(), lines);
        }
        return new TreeWalk(text, lines).root(result.getResult().get()).build(lines);
    }

    private static MalformedStructureException toMalformed(List<Problem> problems, LineIndex lines) {
        if (problems.isEmpty()) {
            return new MalformedStructureException("Unparseable Java source", 1, 0);
        }
        Problem first = problems.get(0);
        Optional<Position> begin = first.getLocation()
                .flatMap(TokenRange::toRange)
                .map(range -> range.begin);
        int line = begin.map(p -> p.line).orElse(1);
        int offset = begin.map(p -> lines.offsetOf(p.line, p.column)).orElse(0);
        String message = first.getMessage().lines().findFirst().orElse("Parse error");
        return new MalformedStructureException(message, line, offset);
    }

    /**
     * Conversion of one parsed compilation unit.
     */
    private static final class TreeWalk {
        private final String text;
        private final LineIndex lines;

        TreeWalk(String text, LineIndex lines) {
            this.text = text;
            this.lines = lines;
        }

        BlockBuilder root(CompilationUnit cu) {
            BlockBuilder root = BlockBuilder.body(0, text.length());
            for (TypeDeclaration<?> type : cu.getTypes()) {
                root.add(type(type));
            }
            return root;
        }

        private BlockBuilder type(TypeDeclaration<?> type) {
            int from = type.getName().getEnd().map(this::offset).orElse(start(type)) + 1;
            if (type instanceof RecordDeclaration record && record.getParameters().isNonEmpty()) {
                from = end(record.getParameters().get(record.getParameters().size() - 1));
            }
            int open = openingBrace(type, from);
            int close = end(type) - 1;
            BlockBuilder block = new BlockBuilder(BlockKind.TYPE, start(type), end(type),
                    text.substring(start(type), open).strip());
            BlockBuilder body = BlockBuilder.body(open + 1, close);
            for (BodyDeclaration<?> member : type.getMembers()) {
                body.add(member(member));
            }
            return block.add(body);
        }

        /**
         * Offset of the first brace of a node at or after {@code from}. Comments are single
         * tokens, so a brace inside one never matches.
         */
        private int openingBrace(Node node, int from) {
            Optional<TokenRange> tokens = node.getTokenRange();
            if (tokens.isPresent()) {
                for (JavaToken token : tokens.get()) {
                    if (token.getText().equals("{")) {
                        int at = token.getRange().map(range -> offset(range.begin)).orElse(-1);
                        if (at >= from) {
                            return at;
                        }
                    }
                }
            }
            return text.indexOf('{', from);
        }

        private BlockBuilder member(BodyDeclaration<?> member) {
            if (member instanceof TypeDeclaration<?> nested) {
                return type(nested);
            }
            if (member instanceof MethodDeclaration method && method.getBody().isPresent()) {
                return function(method, method.getBody().get());
            }
            if (member instanceof ConstructorDeclaration constructor) {
                return function(constructor, constructor.getBody());
            }
            if (member instanceof CompactConstructorDeclaration compact) {
                return function(compact, compact.getBody());
            }
            if (member instanceof InitializerDeclaration initializer) {
                BlockBuilder block = new BlockBuilder(BlockKind.OTHER, start(initializer), end(initializer),
                        header(initializer, initializer.getBody()));
                return block.add(body(initializer.getBody()));
            }
            return statementLike(member);
        }

        private BlockBuilder function(Node declaration, BlockStmt body) {
            BlockBuilder block = new BlockBuilder(BlockKind.FUNCTION, start(declaration), end(declaration),
                    header(declaration, body));
            return block.add(body(body));
        }

        /**
         * Body between the braces of a block statement.
         */
        private BlockBuilder body(BlockStmt block) {
            BlockBuilder body = BlockBuilder.body(start(block) + 1, end(block) - 1);
            for (Statement statement : block.getStatements()) {
                body.add(statement(statement));
            }
            return body;
        }

        /**
         * Body of a branch or loop, which may be a single statement without braces.
         */
        private BlockBuilder branchBody(Statement statement) {
            if (statement instanceof BlockStmt block) {
                return body(block);
            }
            return BlockBuilder.body(start(statement), end(statement)).add(statement(statement));
        }

        private BlockBuilder statement(Statement statement) {
            if (statement instanceof IfStmt ifStmt) {
                return conditional(ifStmt);
            }
            if (statement instanceof ForStmt loop) {
                return loop(loop, loop.getBody());
            }
            if (statement instanceof ForEachStmt loop) {
                return loop(loop, loop.getBody());
            }
            if (statement instanceof WhileStmt loop) {
                return loop(loop, loop.getBody());
            }
            if (statement instanceof DoStmt loop) {
                BlockBuilder block = new BlockBuilder(BlockKind.LOOP, start(loop), end(loop), "do");
                return block.add(branchBody(loop.getBody()));
            }
            if (statement instanceof TryStmt tryStmt) {
                return tryBlock(tryStmt);
            }
            if (statement instanceof SwitchStmt switchStmt) {
                return switchBlock(switchStmt);
            }
            if (statement instanceof SynchronizedStmt sync) {
                BlockBuilder block = new BlockBuilder(BlockKind.OTHER, start(sync), end(sync),
                        header(sync, sync.getBody()));
                return block.add(body(sync.getBody()));
            }
            if (statement instanceof BlockStmt scope) {
                return new BlockBuilder(BlockKind.OTHER, start(scope), end(scope), "").add(body(scope));
            }
            if (statement instanceof LabeledStmt labeled) {
                return statement(labeled.getStatement());
            }
            if (statement instanceof LocalClassDeclarationStmt local) {
                return type(local.getClassDeclaration());
            }
            if (statement instanceof LocalRecordDeclarationStmt local) {
                return type(local.getRecordDeclaration());
            }
            return statementLike(statement);
        }

        private BlockBuilder conditional(IfStmt ifStmt) {
            BlockBuilder block = new BlockBuilder(BlockKind.CONDITIONAL, start(ifStmt), end(ifStmt),
                    header(ifStmt, ifStmt.getThenStmt()));
            IfStmt current = ifStmt;
            while (true) {
                block.addBranch(source(current.getCondition()), branchBody(current.getThenStmt()));
                Optional<Statement> elseStmt = current.getElseStmt();
                if (elseStmt.isEmpty()) {
                    break;
                }
                if (elseStmt.get() instanceof IfStmt elseIf) {
                    current = elseIf;
                } else {
                    block.addBranch(null, branchBody(elseStmt.get()));
                    break;
                }
            }
            return block;
        }

        private BlockBuilder loop(Statement loop, Statement body) {
            BlockBuilder block = new BlockBuilder(BlockKind.LOOP, start(loop), end(loop), header(loop, body));
            return block.add(branchBody(body));
        }

        private BlockBuilder tryBlock(TryStmt tryStmt) {
            BlockBuilder block = new BlockBuilder(BlockKind.OTHER, start(tryStmt), end(tryStmt),
                    header(tryStmt, tryStmt.getTryBlock()));
            block.add(body(tryStmt.getTryBlock()));
            for (CatchClause clause : tryStmt.getCatchClauses()) {
                block.add(body(clause.getBody()));
            }
            tryStmt.getFinallyBlock().ifPresent(fin -> block.add(body(fin)));
            return block;
        }

        private BlockBuilder switchBlock(SwitchStmt switchStmt) {
            int open = openingBrace(switchStmt, end(switchStmt.getSelector()));
            BlockBuilder block = new BlockBuilder(BlockKind.OTHER, start(switchStmt), end(switchStmt),
                    text.substring(start(switchStmt), open).strip());
            BlockBuilder body = BlockBuilder.body(open + 1, end(switchStmt) - 1);
            for (SwitchEntry entry : switchStmt.getEntries()) {
                for (Statement statement : entry.getStatements()) {
                    body.add(statement(statement));
                }
            }
            return block.add(body);
        }

        /**
         * A leaf statement or declaration. Block-bodied lambdas and anonymous classes inside it
         * become children, so conditionals nested in them are still found.
         */
        private BlockBuilder statementLike(Node node) {
            BlockBuilder block = new BlockBuilder(BlockKind.STATEMENT, start(node), end(node), source(node));
            addEmbedded(node, block);
            return block;
        }

        private void addEmbedded(Node node, BlockBuilder owner) {
            for (Node child : node.getChildNodes()) {
                if (child instanceof LambdaExpr lambda && lambda.getBody() instanceof BlockStmt block) {
                    owner.add(function(lambda, block));
                } else if (child instanceof ObjectCreationExpr creation
                        && creation.getAnonymousClassBody().isPresent()) {
                    owner.add(anonymousClass(creation));
                } else {
                    addEmbedded(child, owner);
                }
            }
        }

        private BlockBuilder anonymousClass(ObjectCreationExpr creation) {
            int from = creation.getArguments().isNonEmpty()
                    ? end(creation.getArguments().get(creation.getArguments().size() - 1))
                    : end(creation.getType());
            int open = openingBrace(creation, from);
            BlockBuilder block = new BlockBuilder(BlockKind.TYPE, start(creation), end(creation),
                    text.substring(start(creation), open).strip());
            BlockBuilder body = BlockBuilder.body(open + 1, end(creation) - 1);
            for (BodyDeclaration<?> member : creation.getAnonymousClassBody().get()) {
                body.add(member(member));
            }
            return block.add(body);
        }

        private String header(Node node, Node body) {
            return text.substring(start(node), start(body)).strip();
        }

        private String source(Node node) {
            return text.substring(start(node), end(node));
        }

        private int start(Node node) {
            return offset(node.getBegin().orElseThrow());
        }

        /**
         * Exclusive end offset; JavaParser positions are inclusive.
         */
        private int end(Node node) {
            return offset(node.getEnd().orElseThrow()) + 1;
        }

        private int offset(Position position) {
            return lines.offsetOf(position.line, position.column);
        }
    }
}
