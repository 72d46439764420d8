package com.williamcallahan.flarenormalizer.service.variables;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.williamcallahan.flarenormalizer.domain.VariableSet;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class FlvarParserTest {

    private final FlvarParser parser = new FlvarParser();

    @Test
    void parse_readsValuesInPrecedenceOrder() {
        String content = "<?xml version=\"1.0\" encoding=\"utf-8\"?>\n"
            + "<CatapultVariableSet>"
            + "<Variable Name=\"ProductName\" EvaluatedDefinition=\"Acme\">Ignored</Variable>"
            + "<Variable Name=\"Version\"><Definition>4.2</Definition></Variable>"
            + "<Variable Name=\"Year\" Definition=\"2024\" />"
            + "<Variable Name=\"Company\">Acme Corp</Variable>"
            + "<Variable>No name</Variable>"
            + "</CatapultVariableSet>";

        VariableSet set = parser.parse(Path.of("Project/VariableSets/General.flvar"), content);

        assertEquals("General", set.namespace());
        assertEquals(List.of("ProductName", "Version", "Year", "Company"), List.copyOf(set.variables().keySet()));
        assertEquals(Optional.of("Acme"), set.valueOf("ProductName"));
        assertEquals(Optional.of("4.2"), set.valueOf("Version"));
        assertEquals(Optional.of("2024"), set.valueOf("Year"));
        assertEquals(Optional.of("Acme Corp"), set.valueOf("Company"));
    }

    @Test
    void parse_rejectsContentWithoutVariableSetRoot() {
        assertThrows(IllegalArgumentException.class,
            () -> parser.parse(Path.of("Broken.flvar"), "<Something><Variable Name=\"X\">1</Variable></Something>"));
    }

    @Test
    void toAttributeName_producesKebabCase() {
        assertEquals("general-product-name", VariableNameFormatter.toAttributeName("General.ProductName"));
        assertEquals("support-phone", VariableNameFormatter.toAttributeName("Support.Phone"));
        assertEquals("", VariableNameFormatter.toAttributeName("  "));
    }
}
