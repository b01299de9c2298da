package io.automation.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RuleModelTest {

  @Test
  void stageChangeRejectsDuplicateBindings() {
    assertThrows(IllegalArgumentException.class, () -> new RuleSpec.StageChange("booked", List.of(
        BusinessTriggerBinding.on(BusinessEventKind.DEPOSIT_PAID),
        BusinessTriggerBinding.on(BusinessEventKind.DEPOSIT_PAID))));
  }

  @Test
  void bindingMatchesOnAmountAndSubtype() {
    BusinessTriggerBinding binding = new BusinessTriggerBinding(BusinessEventKind.FULL_PAYMENT_MADE, 1000L, "card");

    assertTrue(binding.matches(new BusinessEventPayload(1000L, "card")));
    assertFalse(binding.matches(new BusinessEventPayload(999L, "card")));
    assertFalse(binding.matches(new BusinessEventPayload(5000L, "bank")));
    assertFalse(binding.matches(null));
    assertTrue(BusinessTriggerBinding.on(BusinessEventKind.FULL_PAYMENT_MADE).matches(null));
  }

  @Test
  void bindingForReturnsNullWhenUnbound() {
    RuleSpec.StageChange spec = new RuleSpec.StageChange("booked",
        List.of(BusinessTriggerBinding.on(BusinessEventKind.CONTRACT_SIGNED)));

    assertNull(spec.bindingFor(BusinessEventKind.PROJECT_BOOKED));
    assertEquals(BusinessEventKind.CONTRACT_SIGNED, spec.bindingFor(BusinessEventKind.CONTRACT_SIGNED).kind());
  }

  @Test
  void countdownSignsOffsetByTiming() {
    RuleSpec.Countdown before = new RuleSpec.Countdown(Channel.SMS, "t", 3, CountdownTiming.BEFORE, LocalTime.NOON, null);
    RuleSpec.Countdown after = new RuleSpec.Countdown(Channel.SMS, "t", 3, CountdownTiming.AFTER, LocalTime.NOON, null);

    assertEquals(-3, before.signedOffsetDays());
    assertEquals(3, after.signedOffsetDays());
    assertThrows(IllegalArgumentException.class, () ->
        new RuleSpec.Countdown(Channel.SMS, "t", -1, CountdownTiming.AFTER, LocalTime.NOON, null));
  }

  @Test
  void ruleIsEffectiveFromItsStartInstant() {
    Instant from = Instant.parse("2025-01-01T00:00:00Z");
    Rule rule = new Rule("r1", "t1", "n", true, from, null, new RuleSpec.Nurture("lineage"));

    assertTrue(rule.isEffectiveAt(from));
    assertFalse(rule.isEffectiveAt(from.minusMillis(1)));
    assertFalse(rule.isEffectiveAt(null));
    assertEquals(RuleKind.NURTURE, rule.kind());
  }

  @Test
  void naturalKeysHaveStableStringForms() {
    assertEquals("communication:p1:s1", new NaturalKey.Communication("p1", "s1").value());
    assertEquals("stage-change:p1:r1:DEPOSIT_PAID",
        new NaturalKey.StageChange("p1", "r1", BusinessEventKind.DEPOSIT_PAID).value());
    assertEquals("countdown:p1:r1:2025-06-14:7",
        new NaturalKey.Countdown("p1", "r1", LocalDate.of(2025, 6, 14), 7).value());
    assertEquals("delivery:sub:item", new NaturalKey.Delivery("sub", "item").value());
  }

  @Test
  void executionStatusRoundTripsThroughCode() {
    for (ExecutionStatus status : ExecutionStatus.values()) {
      assertEquals(status, ExecutionStatus.fromCode(status.code()));
    }
    assertThrows(IllegalArgumentException.class, () -> ExecutionStatus.fromCode(42));
  }
}
