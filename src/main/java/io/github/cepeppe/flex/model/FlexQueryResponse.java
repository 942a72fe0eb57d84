package io.github.cepeppe.flex.model;

import io.github.cepeppe.flex.schema.FlexAttribute;
import io.github.cepeppe.flex.schema.FlexElement;
import io.github.cepeppe.flex.schema.FlexSection;

import java.util.List;

/**
 * Radice del documento Flex.
 * <p>
 * Contiene esattamente un wrapper {@code FlexStatements} il cui attributo {@code count} deve coincidere
 * con il numero di statement. Immutabile: le liste sono copie non modificabili.
 */
@FlexElement("FlexQueryResponse")
public record FlexQueryResponse(
        @FlexAttribute(required = true) String queryName,
        String type,
        @FlexSection(value = "FlexStatements", countAttribute = "count", required = true)
        List<FlexStatement> statements
) {

    public FlexQueryResponse {
        statements = statements == null ? List.of() : List.copyOf(statements);
    }
}
