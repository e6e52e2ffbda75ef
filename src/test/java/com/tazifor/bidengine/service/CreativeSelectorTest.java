package com.tazifor.bidengine.service;

import com.tazifor.bidengine.model.Creative;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class CreativeSelectorTest {

    private final CreativeSelector target = new CreativeSelector();

    @Test
    public void selectShouldBeDeterministicPerRequestId() {
        // given
        List<Creative> creatives = List.of(creative("a"), creative("b"), creative("c"));

        // when and then
        assertThat(target.select("req-42", creatives)).isEqualTo(target.select("req-42", creatives));
    }

    @Test
    public void selectShouldReturnEmptyWithoutCreatives() {
        assertThat(target.select("req-1", List.of())).isEmpty();
        assertThat(target.select("req-1", null)).isEmpty();
    }

    @Test
    public void selectShouldHandleNegativeHashCodes() {
        // given
        String requestId = "polygenelubricants";

        // when and then
        assertThat(requestId.hashCode()).isNegative();
        assertThat(target.select(requestId, List.of(creative("a"), creative("b")))).isPresent();
    }

    private static Creative creative(String id) {
        return Creative.builder().id(id).adm("<ad/>").build();
    }
}
