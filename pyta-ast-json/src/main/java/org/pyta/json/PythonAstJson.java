package org.pyta.json;

import org.pyta.ast.SourceSpan;
import org.pyta.ast.SyntaxTree;
import org.pyta.engine.FileReport;
import org.pyta.engine.PythonAnalyzer;
import org.pyta.lint.AnalysisError;
import org.pyta.lint.MalformedInputException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

/// Parse adapter: loads a Python `ast` module exported as JSON.
///
/// Every node is a JSON object with `_type` naming its Python class, the position attributes
/// `lineno`, `col_offset`, `end_lineno`, `end_col_offset` where Python has them, and its fields
/// under their Python names.
///
/// Usage:
/// ```java
/// var tree = PythonAstJson.pythonAstJson()
///                         .read(Path.of("exercise.py.json"));
/// var report = PythonAnalyzer.pythonAnalyzer()
///                            .analyze(tree);
/// ```
public final class PythonAstJson {
    private static final Logger log = LoggerFactory.getLogger(PythonAstJson.class);

    private final JsonMapper mapper;

    private PythonAstJson(JsonMapper mapper) {
        this.mapper = mapper;
    }

    public static PythonAstJson pythonAstJson() {
        return new PythonAstJson(JsonMapper.builder()
                                           .build());
    }

    /// Convert a JSON document into a syntax tree.
    ///
    /// @throws MalformedInputException if the document is not valid JSON or does not describe a Python module
    public SyntaxTree parse(String fileName, String json) {
        Object document;
        try {
            document = mapper.readValue(json, Object.class);
        } catch (JacksonException e) {
            throw new MalformedInputException(new AnalysisError.MalformedInput(SourceSpan.FILE_START,
                                                                               "invalid JSON: "
                                                                               + e.getOriginalMessage()),
                                              e);
        }
        var tree = AstConverter.convert(fileName, document);
        log.debug("Loaded {} with {} nodes", fileName, tree.size());
        return tree;
    }

    /// Read a JSON file; the path becomes the file name of the tree.
    public SyntaxTree read(Path path) throws IOException {
        return parse(path.toString(), Files.readString(path, StandardCharsets.UTF_8));
    }

    /// Parse and analyze a JSON document. Input that cannot be loaded yields a report holding
    /// a single `analysis-failed` diagnostic.
    public FileReport analyze(PythonAnalyzer analyzer, String fileName, String json) {
        try {
            return analyzer.analyze(parse(fileName, json));
        } catch (MalformedInputException e) {
            log.warn("Cannot load {}: {}", fileName, e.getMessage());
            return FileReport.failed(fileName, e.error());
        }
    }
}
