package io.github.cepeppe.flex.model;

import io.github.cepeppe.flex.codes.AccountCapability;
import io.github.cepeppe.flex.codes.FlexCode;
import io.github.cepeppe.flex.codes.TradingPermission;
import io.github.cepeppe.flex.schema.FlexAttribute;
import io.github.cepeppe.flex.schema.FlexElement;

import java.time.LocalDate;
import java.util.List;

/**
 * Anagrafica del conto (elemento singolo dentro {@code FlexStatement}).
 *
 * @param accountId           l'identificativo del conto
 * @param acctAlias           l'alias assegnato dal titolare
 * @param model               il modello di portafoglio (conti advisor)
 * @param currency            la valuta base del conto
 * @param name                l'intestatario
 * @param accountType         la tipologia (es. {@code Individual})
 * @param customerType        la tipologia di cliente
 * @param accountCapabilities le capability del conto (lista separata da {@code ,})
 * @param tradingPermissions  i permessi di trading (lista separata da {@code ,})
 * @param dateOpened          la data di apertura
 * @param dateFunded          la data del primo deposito
 * @param dateClosed          la data di chiusura, {@code null} se il conto è attivo
 * @param masterName          il nome del conto master (conti advisor/broker)
 * @param ibEntity            l'entità legale del broker che detiene il conto
 * @param primaryEmail        l'email principale
 */
@FlexElement("AccountInformation")
public record AccountInformation(
        @FlexAttribute(required = true) String accountId,
        String acctAlias,
        String model,
        String currency,
        String name,
        String accountType,
        String customerType,
        @FlexAttribute(separator = ",") List<FlexCode<AccountCapability>> accountCapabilities,
        @FlexAttribute(separator = ",") List<FlexCode<TradingPermission>> tradingPermissions,
        LocalDate dateOpened,
        LocalDate dateFunded,
        LocalDate dateClosed,
        String masterName,
        String ibEntity,
        String primaryEmail
) {
}
