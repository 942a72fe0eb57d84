package io.github.cepeppe.flex.model;

import io.github.cepeppe.flex.codes.AssetClass;
import io.github.cepeppe.flex.codes.Code;
import io.github.cepeppe.flex.codes.FlexCode;
import io.github.cepeppe.flex.codes.LevelOfDetail;
import io.github.cepeppe.flex.schema.FlexElement;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Lotto di valuta estera (dentro {@code FxPositions/FxLots}).
 */
@FlexElement("FxLot")
public record FxLot(
        String accountId,
        String acctAlias,
        String model,
        FlexCode<AssetClass> assetCategory,
        LocalDate reportDate,
        String functionalCurrency,
        String fxCurrency,
        BigDecimal quantity,
        BigDecimal costPrice,
        BigDecimal costBasis,
        BigDecimal closePrice,
        BigDecimal value,
        BigDecimal unrealizedPL,
        List<FlexCode<Code>> code,
        String lotDescription,
        LocalDateTime lotOpenDateTime,
        FlexCode<LevelOfDetail> levelOfDetail
) {
}
