package com.finanalytix.backend.classification;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.regex.Pattern;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.finanalytix.backend.classification.rules.CategoryPatterns;
import com.finanalytix.backend.classification.rules.CategoryPatterns.CategoryPattern;

@DisplayName("TransactionClassifier - categorías y RFC")
class TransactionClassifierTest {

    private TransactionClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new TransactionClassifier(CategoryPatterns.mexicanSmeDefaults());
    }

    @Test
    void payrollWinsOverLaterCategories() {
        assertThat(classifier.classify("Pago de nómina a empleado")).isEqualTo(CategoryPatterns.PAYROLL);
        assertThat(classifier.classify("PAGO DE NOMINA QUINCENAL")).isEqualTo(CategoryPatterns.PAYROLL);
    }

    @Test
    void classifiesEachCategory() {
        assertThat(classifier.classify("Traspaso a cuenta de inversion")).isEqualTo(CategoryPatterns.INTERNAL_TRANSFERS);
        assertThat(classifier.classify("Pago proveedor ABC")).isEqualTo(CategoryPatterns.SUPPLIERS);
        assertThat(classifier.classify("Pago SAT declaracion anual")).isEqualTo(CategoryPatterns.TAXES);
        assertThat(classifier.classify("Comisión bancaria mensual")).isEqualTo(CategoryPatterns.SERVICES);
        assertThat(classifier.classify("Deposito cliente")).isEqualTo(CategoryPatterns.CUSTOMERS);
        assertThat(classifier.classify("Amortización crédito")).isEqualTo(CategoryPatterns.FINANCING);
    }

    @Test
    void otherWhenNothingMatches() {
        assertThat(classifier.classify("Compra OXXO")).isEqualTo(CategoryPatterns.OTHER);
        assertThat(classifier.classify("")).isEqualTo(CategoryPatterns.OTHER);
        assertThat(classifier.classify(null)).isEqualTo(CategoryPatterns.OTHER);
    }

    @Test
    void classificationIsRepeatable() {
        String desc = "Transferencia cliente SPEI";
        assertThat(classifier.classify(desc)).isEqualTo(classifier.classify(desc));
    }

    @Test
    void usesInjectedPatterns() {
        TransactionClassifier custom = new TransactionClassifier(CategoryPatterns.of(List.of(
                new CategoryPattern("renta", Pattern.compile("arrendamiento")))));

        assertThat(custom.classify("Pago arrendamiento local")).isEqualTo("renta");
        assertThat(custom.classify("Pago de nómina")).isEqualTo(CategoryPatterns.OTHER);
    }

    @Test
    void extractsTwelveCharacterRfc() {
        assertThat(classifier.extractTaxId("Pago a ABC010101AB9 por servicios")).isEqualTo("ABC010101AB9");
    }

    @Test
    void extractsThirteenCharacterRfcFromLowercaseText() {
        assertThat(classifier.extractTaxId("spei gode561231gr8 honorarios")).isEqualTo("GODE561231GR8");
    }

    @Test
    void rejectsFourteenCharacterRun() {
        assertThat(classifier.extractTaxId("Pago a ABCD010101AB9X por servicios")).isNull();
    }

    @Test
    void noRfcInPlainText() {
        assertThat(classifier.extractTaxId("Deposito en efectivo")).isNull();
        assertThat(classifier.extractTaxId(null)).isNull();
    }
}
