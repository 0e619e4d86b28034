package dev.fumaz.sprout.bind;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ServiceKeysTest {

    @Test
    void convertsTypeNamesToSnakeCase() {
        assertEquals("camel_case", ServiceKeys.toStandardParamName("CamelCase"));
        assertEquals("http_response", ServiceKeys.toStandardParamName("HTTPResponse"));
        assertEquals("icats_repository", ServiceKeys.toStandardParamName("ICatsRepository"));
        assertEquals("cat", ServiceKeys.toStandardParamName("Cat"));
        assertEquals("ufo", ServiceKeys.toStandardParamName("UFO"));
    }

    @Test
    void convertsTypeNamesToLowerCamelCase() {
        assertEquals("catsController", ServiceKeys.toCamelParamName("CatsController"));
        assertEquals("httpResponse", ServiceKeys.toCamelParamName("HTTPResponse"));
        assertEquals("cat", ServiceKeys.toCamelParamName("Cat"));
    }

    @Test
    void producesEveryNameVariantOfAType() {
        Set<String> variants = ServiceKeys.nameVariants(CatsController.class);

        assertEquals(Set.of("CatsController", "catscontroller", "cats_controller", "catsController"), variants);
    }

    @Test
    void anonymousAndArrayTypesHaveNoName() {
        Object anonymous = new Object() {
        };

        assertNull(ServiceKeys.canonicalName(anonymous.getClass()));
        assertNull(ServiceKeys.canonicalName(String[].class));
        assertTrue(ServiceKeys.nameVariants(String[].class).isEmpty());
    }

    static class CatsController {
    }
}
