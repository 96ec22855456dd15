package me.golemcore.humanloop.domain.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PizzaOrderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void shouldParseToolArguments() throws Exception {
        String json = """
                {"pizzas": [
                  {"size": "large", "toppings": ["pepperoni", "mushrooms"], "special_instructions": "well done"},
                  {"size": "small", "toppings": ["cheese"]}
                ], "note": "ignored"}
                """;

        PizzaOrder order = objectMapper.readValue(json, PizzaOrder.class);

        assertEquals(2, order.pizzas().size());
        Pizza first = order.pizzas().get(0);
        assertEquals("large", first.size());
        assertEquals(List.of("pepperoni", "mushrooms"), first.toppings());
        assertEquals("well done", first.specialInstructions());
        assertTrue(first.hasSpecialInstructions());
        assertFalse(order.pizzas().get(1).hasSpecialInstructions());
    }

    @Test
    void shouldWriteSpecialInstructionsInSnakeCase() throws Exception {
        Pizza pizza = new Pizza("medium", List.of("olives"), "extra crispy");

        String json = objectMapper.writeValueAsString(pizza);

        assertTrue(json.contains("\"special_instructions\":\"extra crispy\""));
    }

    @Test
    void shouldTreatMissingPizzasAsEmpty() throws Exception {
        PizzaOrder order = objectMapper.readValue("{}", PizzaOrder.class);

        assertTrue(order.isEmpty());
    }

    @Test
    void shouldCopyToppings() {
        List<String> toppings = new ArrayList<>(List.of("ham"));
        Pizza pizza = new Pizza("large", toppings, null);

        toppings.add("pineapple");

        assertEquals(List.of("ham"), pizza.toppings());
    }
}
