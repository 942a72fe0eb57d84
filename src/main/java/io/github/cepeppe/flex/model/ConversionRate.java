package io.github.cepeppe.flex.model;

import io.github.cepeppe.flex.schema.FlexAttribute;
import io.github.cepeppe.flex.schema.FlexElement;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Tasso di cambio usato dal fornitore per convertire gli importi in valuta base.
 *
 * @param reportDate   la data a cui si riferisce il tasso
 * @param fromCurrency la valuta di origine
 * @param toCurrency   la valuta di destinazione (di norma la valuta base del conto)
 * @param rate         il tasso: {@code 1 fromCurrency = rate toCurrency}
 */
@FlexElement("ConversionRate")
public record ConversionRate(
        @FlexAttribute(required = true) LocalDate reportDate,
        @FlexAttribute(required = true) String fromCurrency,
        @FlexAttribute(required = true) String toCurrency,
        @FlexAttribute(required = true) BigDecimal rate
) {
}
