package ca.gc.cra.tracker.domain.events;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EventsTest {

  @Test
  void buildViewDefaultsTitleToViewName() {
    ViewEvent view = Events.buildView("product_detail", null, Map.of());

    assertEquals("product_detail", view.viewName());
    assertEquals("product_detail", view.title());
    assertEquals(Map.of(), view.values());
    assertEquals(EventName.VIEW, view.eventName());
  }

  @Test
  void buildViewKeepsExplicitTitle() {
    ViewEvent view = Events.buildView("product_detail", "Product", null);

    assertEquals("Product", view.title());
    assertTrue(view.values().isEmpty());
  }

  @Test
  void buildNamedWrapsNameAndValues() {
    NamedEvent event = Events.buildNamed("purchase", Map.of("amount", 500));

    assertEquals(new EventName("purchase"), event.eventName());
    assertEquals(Map.of("amount", 500), event.values());
  }

  @Test
  void buildIdentifyAcceptsEmptyPayload() {
    IdentifyEvent event = Events.buildIdentify(Map.of());

    assertEquals(EventName.IDENTIFY, event.eventName());
    assertTrue(event.values().isEmpty());
  }

  @Test
  void valuesAreCopiedAndUnmodifiable() {
    Map<String, Object> source = new HashMap<>();
    source.put("email", "a@example.com");
    source.put("nickname", null);

    IdentifyEvent event = Events.buildIdentify(source);
    source.put("email", "changed@example.com");

    assertEquals("a@example.com", event.values().get("email"));
    assertTrue(event.values().containsKey("nickname"));
    assertNull(event.values().get("nickname"));
    assertThrows(UnsupportedOperationException.class, () -> event.values().put("x", 1));
  }

  @Test
  void nestedValuesAreCopiedAtBuildTime() {
    List<Object> items = new ArrayList<>(List.of("sku-1"));
    Map<String, Object> shipping = new HashMap<>();
    shipping.put("city", "Ottawa");
    String[] tags = {"gift"};

    NamedEvent event = Events.buildNamed("purchase", Map.of("items", items, "shipping", shipping, "tags", tags));
    items.add("sku-2");
    shipping.put("city", "Toronto");
    tags[0] = "sale";

    assertEquals(List.of("sku-1"), event.values().get("items"));
    assertEquals(Map.of("city", "Ottawa"), event.values().get("shipping"));
    assertEquals(List.of("gift"), event.values().get("tags"));
    @SuppressWarnings("unchecked")
    List<Object> copied = (List<Object>) event.values().get("items");
    assertThrows(UnsupportedOperationException.class, () -> copied.add("sku-3"));
  }

  @Test
  void namedEventRejectsNullName() {
    assertThrows(NullPointerException.class, () -> Events.buildNamed(null, Map.of()));
  }

  @Test
  void eventNameValidity() {
    assertTrue(new EventName("add_to_cart").isValid());
    assertTrue(new EventName("purchase2").isValid());
    assertFalse(new EventName("").isValid());
    assertFalse(new EventName("_internal").isValid());
    assertFalse(new EventName("Add To Cart").isValid());
    assertFalse(new EventName("a".repeat(EventName.MAX_LENGTH + 1)).isValid());
  }
}
