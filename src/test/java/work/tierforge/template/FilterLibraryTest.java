package work.tierforge.template;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.Test;

class FilterLibraryTest {
    @Test
    void convertsBetweenCasings() {
        assertEquals("TestName", FilterLibrary.pascalCase("test_name"));
        assertEquals("test_name", FilterLibrary.snakeCase("TestName"));
        assertEquals("test-name", FilterLibrary.kebabCase("TestName"));
    }

    @Test
    void handlesAcronymsAndDashes() {
        assertEquals("http_server_error", FilterLibrary.snakeCase("HTTPServerError"));
        assertEquals("UserProfile", FilterLibrary.pascalCase("user-profile"));
        assertEquals("UserProfile", FilterLibrary.pascalCase("UserProfile"));
        assertEquals("order_id", FilterLibrary.snakeCase("orderId"));
    }

    @Test
    void validatesIdentifiers() {
        assertEquals("valid_name", FilterLibrary.validateIdentifier("valid_name"));
        assertEquals("_private1", FilterLibrary.validateIdentifier("_private1"));
        var error = assertThrows(IllegalArgumentException.class, () -> FilterLibrary.validateIdentifier("123bad"));
        assertTrue(error.getMessage().contains("123bad"));
        assertThrows(IllegalArgumentException.class, () -> FilterLibrary.validateIdentifier("has space"));
        assertThrows(IllegalArgumentException.class, () -> FilterLibrary.validateIdentifier(""));
    }

    @Test
    void sameInputAlwaysGivesSameOutput() {
        for (int i = 0; i < 3; i++) {
            assertEquals("TestName", FilterLibrary.pascalCase("test_name"));
            assertEquals("test-name", FilterLibrary.kebabCase("TestName"));
        }
    }

    @Test
    void exposesFiltersUnderTemplateNames() {
        var filters = FilterLibrary.filters();
        assertEquals(List.of("pascalcase", "snakecase", "kebabcase", "validate_identifier"), List.copyOf(filters.keySet()));
        assertTrue(filters.values().stream().allMatch(filter -> filter.getArgumentNames().isEmpty()));
    }

    @Test
    void casingIgnoresTheDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals("title_id", FilterLibrary.snakeCase("TITLE_ID"));
            assertEquals("invoice-item", FilterLibrary.kebabCase("InvoiceItem"));
        } finally {
            Locale.setDefault(previous);
        }
    }
}
