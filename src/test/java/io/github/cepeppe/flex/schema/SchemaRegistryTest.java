package io.github.cepeppe.flex.schema;

import io.github.cepeppe.flex.codes.BuySell;
import io.github.cepeppe.flex.codes.Code;
import io.github.cepeppe.flex.codes.FlexCode;
import io.github.cepeppe.flex.coercion.FieldType;
import io.github.cepeppe.flex.exception.FlexException;
import io.github.cepeppe.flex.model.FlexQueryResponse;
import io.github.cepeppe.flex.model.FlexStatement;
import io.github.cepeppe.flex.model.FxLot;
import io.github.cepeppe.flex.model.Trade;
import io.github.cepeppe.flex.model.TradeConfirmation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test del registry degli schemi.
 *
 * Copre:
 * - il vocabolario Flex derivato dai record del package model (nomi, tipi, obbligatorietà, sezioni);
 * - il lookup di elementi fuori vocabolario;
 * - il rifiuto di dichiarazioni incoerenti su record di prova.
 */
class SchemaRegistryTest {

    /* =======================================================================
       RECORD DI PROVA
       ======================================================================= */

    @FlexElement("Item")
    record Item(BigDecimal amount) {}

    @FlexElement("Root")
    record Root(@FlexAttribute(required = true) String name,
                Integer size,
                @FlexAttribute("kind") FlexCode<BuySell> side,
                @FlexAttribute(separator = ",") List<FlexCode<Code>> flags,
                @FlexSection(value = "Items", countAttribute = "n") List<Item> items) {}

    record NotAnnotated(String a) {}

    @FlexElement("BadType")
    record BadType(double value) {}

    @FlexElement("BadSection")
    record BadSection(@FlexSection("X") Item item) {}

    @FlexElement("Dup")
    record DupA(String x) {}

    @FlexElement("Dup")
    record DupB(String y) {}

    @FlexElement("Clash")
    record Clash(DupA a, DupB b) {}

    // -----------------------------------------------------------------------------------------------------------------
    // Vocabolario Flex
    // -----------------------------------------------------------------------------------------------------------------
    @Nested
    @DisplayName("Vocabolario Flex")
    class FlexVocabulary {

        private final SchemaRegistry registry = SchemaRegistry.getInstance();

        @Test
        @DisplayName("Radice FlexQueryResponse con sezione FlexStatements obbligatoria e contata")
        void root() {
            RecordSchema root = registry.root();
            assertEquals("FlexQueryResponse", root.elementName());
            assertEquals(FlexQueryResponse.class, root.type());

            ChildSpec statements = root.child("FlexStatements");
            assertNotNull(statements);
            assertEquals(ChildSpec.Kind.SECTION, statements.kind());
            assertTrue(statements.required());
            assertEquals("count", statements.countAttribute());
            assertEquals(FlexStatement.class, statements.itemType());
        }

        @Test
        @DisplayName("Singleton condiviso")
        void singleton() {
            assertSame(SchemaRegistry.getInstance(), SchemaRegistry.getInstance());
        }

        @Test
        @DisplayName("Tutti gli elementi del vocabolario sono registrati")
        void elementNames() {
            assertTrue(registry.elementNames().containsAll(List.of(
                    "FlexQueryResponse", "FlexStatement", "AccountInformation", "ChangeInNAV", "Trade",
                    "OpenPosition", "CashTransaction", "ConversionRate", "FxLot", "TradeConfirm", "OptionEAE",
                    "CorporateAction", "SecurityInfo", "EquitySummaryByReportDateInBase")));
        }

        @Test
        @DisplayName("Trade: tipi degli attributi dedotti dai componenti")
        void tradeAttributes() {
            RecordSchema trade = registry.schemaOf(Trade.class);

            AttributeSpec buySell = trade.attribute("buySell");
            assertEquals(FieldType.CODE, buySell.target().type());
            assertEquals(BuySell.class, buySell.target().codeTable());

            AttributeSpec notes = trade.attribute("notes");
            assertEquals(FieldType.CODE_LIST, notes.target().type());
            assertEquals(";", notes.target().separator());

            assertEquals(FieldType.DECIMAL, trade.attribute("quantity").target().type());
            assertEquals(FieldType.TIME, trade.attribute("tradeTime").target().type());
            assertEquals(FieldType.DATE_TIME, trade.attribute("orderTime").target().type());
            assertEquals(FieldType.BOOLEAN, trade.attribute("isAPIOrder").target().type());
            assertNull(trade.attribute("newVendorField"));
            assertTrue(trade.children().isEmpty());
        }

        @Test
        @DisplayName("FlexStatement: attributi obbligatori, figli singoli e sezioni annidate")
        void statementShape() {
            RecordSchema statement = registry.schemaOf(FlexStatement.class);

            assertTrue(statement.attribute("accountId").required());
            assertTrue(statement.attribute("fromDate").required());
            assertTrue(statement.attribute("toDate").required());
            assertFalse(statement.attribute("period").required());

            assertEquals(ChildSpec.Kind.SINGLE, statement.child("AccountInformation").kind());

            ChildSpec fx = statement.child("FxPositions");
            assertTrue(fx.hasNested());
            assertEquals("FxLots", fx.nested());
            assertEquals(FxLot.class, fx.itemType());

            ChildSpec confirms = statement.child("TradeConfirms");
            assertEquals("TradeConfirm", confirms.itemElement());
            assertEquals(TradeConfirmation.class, confirms.itemType());

            // wrapper e item con lo stesso nome
            ChildSpec eae = statement.child("OptionEAE");
            assertEquals(ChildSpec.Kind.SECTION, eae.kind());
            assertEquals("OptionEAE", eae.itemElement());
        }

        @Test
        @DisplayName("Elemento sconosciuto → Unmapped, mai un errore")
        void lookupUnknown() {
            ElementBinding binding = registry.lookup("FancyNewSection");
            assertInstanceOf(ElementBinding.Unmapped.class, binding);
            assertEquals("FancyNewSection", ((ElementBinding.Unmapped) binding).elementName());

            assertInstanceOf(ElementBinding.Mapped.class, registry.lookup("Trade"));
        }

        @Test
        @DisplayName("schemaOf() di un tipo estraneo → IllegalArgumentException")
        void schemaOfForeignType() {
            assertThrows(IllegalArgumentException.class, () -> registry.schemaOf(Item.class));
        }
    }

    // -----------------------------------------------------------------------------------------------------------------
    // Registry costruiti su record di prova
    // -----------------------------------------------------------------------------------------------------------------
    @Nested
    @DisplayName("forRoot() su record di prova")
    class CustomRoots {

        @Test
        @DisplayName("Nomi da @FlexAttribute, separatore personalizzato, sezione contata")
        void customRoot() {
            SchemaRegistry registry = SchemaRegistry.forRoot(Root.class);
            RecordSchema root = registry.root();

            assertEquals("Root", root.elementName());
            assertEquals(5, root.arity());
            assertTrue(root.attribute("name").required());
            assertEquals(FieldType.INTEGER, root.attribute("size").target().type());
            assertNull(root.attribute("side"));
            assertEquals(FieldType.CODE, root.attribute("kind").target().type());
            assertEquals(",", root.attribute("flags").target().separator());

            ChildSpec items = root.child("Items");
            assertEquals("Item", items.itemElement());
            assertTrue(items.hasCount());
            assertFalse(items.required());
            assertEquals(registry.schemaOf(Item.class), registry.schemaOf(items.itemType()));
        }

        @Test
        @DisplayName("instantiate() invoca il costruttore canonico")
        void instantiate() {
            RecordSchema item = SchemaRegistry.forRoot(Root.class).schemaOf(Item.class);
            Record built = item.instantiate(new Object[]{new BigDecimal("1.50")});
            assertEquals(new Item(new BigDecimal("1.50")), built);
        }

        @Test
        @DisplayName("instantiate() con argomenti errati → FlexException INTERNAL")
        void instantiateWrongArgs() {
            RecordSchema item = SchemaRegistry.forRoot(Root.class).schemaOf(Item.class);
            FlexException ex = assertThrows(FlexException.class, () -> item.instantiate(new Object[]{"x"}));
            assertEquals(FlexException.Code.INTERNAL, ex.getCode());
        }

        @Test
        @DisplayName("Dichiarazioni incoerenti → IllegalStateException")
        void invalidDeclarations() {
            assertThrows(IllegalStateException.class, () -> SchemaRegistry.forRoot(NotAnnotated.class));
            assertThrows(IllegalStateException.class, () -> SchemaRegistry.forRoot(BadType.class));
            assertThrows(IllegalStateException.class, () -> SchemaRegistry.forRoot(BadSection.class));
        }

        @Test
        @DisplayName("Due record con lo stesso nome di elemento → IllegalStateException")
        void elementNameClash() {
            IllegalStateException ex = assertThrows(IllegalStateException.class,
                    () -> SchemaRegistry.forRoot(Clash.class));
            assertTrue(ex.getMessage().contains("Dup"));
        }
    }
}
