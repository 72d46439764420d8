package com.williamcallahan.flarenormalizer.service.variables;

import com.williamcallahan.flarenormalizer.domain.VariableSet;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Parses MadCap variable set files ({@code CatapultVariableSet} XML).
 *
 * A variable's value is taken from the first non-blank of: the {@code EvaluatedDefinition}
 * attribute, a {@code Definition} child element, the {@code Definition} attribute, the element's
 * own text. Variables without a {@code Name} are skipped.
 */
@Service
public class FlvarParser {

    private static final Logger log = LoggerFactory.getLogger(FlvarParser.class);
    private static final String FLVAR_EXTENSION = ".flvar";

    /**
     * Parses one variable set.
     *
     * @param sourcePath file the content was read from; its name without extension is the namespace
     * @param content XML content
     * @return parsed variables in file order
     * @throws IllegalArgumentException when the content has no {@code CatapultVariableSet} root
     */
    public VariableSet parse(Path sourcePath, String content) {
        String namespace = namespaceOf(sourcePath);
        Document xml = Jsoup.parse(content == null ? "" : content, "", Parser.xmlParser());
        if (xml.selectFirst("CatapultVariableSet") == null) {
            throw new IllegalArgumentException("Missing CatapultVariableSet root element in " + sourcePath);
        }

        Map<String, String> variables = new LinkedHashMap<>();
        for (Element variable : xml.select("Variable")) {
            String name = variable.attr("Name").trim();
            if (name.isEmpty()) {
                log.debug("Skipping Variable without Name in {}", sourcePath);
                continue;
            }
            variables.put(name, valueOf(variable));
        }
        return new VariableSet(namespace, sourcePath, variables);
    }

    private static String valueOf(Element variable) {
        String evaluated = variable.attr("EvaluatedDefinition");
        if (!evaluated.isBlank()) {
            return evaluated.trim();
        }
        Element definitionChild = variable.selectFirst("> Definition");
        if (definitionChild != null && !definitionChild.text().isBlank()) {
            return definitionChild.text().trim();
        }
        String definition = variable.attr("Definition");
        if (!definition.isBlank()) {
            return definition.trim();
        }
        return variable.text().trim();
    }

    static String namespaceOf(Path sourcePath) {
        if (sourcePath == null || sourcePath.getFileName() == null) {
            return "";
        }
        String fileName = sourcePath.getFileName().toString();
        return fileName.endsWith(FLVAR_EXTENSION)
            ? fileName.substring(0, fileName.length() - FLVAR_EXTENSION.length())
            : fileName;
    }
}
