package com.inventorytracker.backend.modules.item.presentation.dto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Set;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidNullException;
import com.inventorytracker.backend.global.common.PatchField;
import com.inventorytracker.backend.modules.item.application.ItemPatch;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;

import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class UpdateItemRequestTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static ValidatorFactory validatorFactory;
    private static Validator validator;

    @BeforeAll
    static void setUpValidator() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = validatorFactory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        validatorFactory.close();
    }

    @Test
    @DisplayName("omitted fields stay absent")
    void omittedFieldsAreAbsent() throws Exception {
        ItemPatch patch = read("{}").toPatch();

        assertThat(patch.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("an explicit null description is present with a null value")
    void explicitNullDescriptionIsPresent() throws Exception {
        ItemPatch patch = read("{\"description\": null}").toPatch();

        assertThat(patch.description()).isEqualTo(PatchField.of(null));
        assertThat(patch.name().isPresent()).isFalse();
        assertThat(patch.quantity().isPresent()).isFalse();
        assertThat(patch.isEmpty()).isFalse();
    }

    @Test
    @DisplayName("values sent in the body are carried into the patch")
    void presentValuesAreCarried() throws Exception {
        ItemPatch patch = read("{\"name\": \"Bolt\", \"description\": \"\", \"quantity\": 0}").toPatch();

        assertThat(patch.name().get()).isEqualTo("Bolt");
        assertThat(patch.description().get()).isEmpty();
        assertThat(patch.quantity().get()).isZero();
    }

    @Test
    @DisplayName("explicit null name or quantity is rejected while reading")
    void explicitNullNameOrQuantityFails() {
        assertThatThrownBy(() -> read("{\"name\": null}"))
                .isInstanceOf(InvalidNullException.class);
        assertThatThrownBy(() -> read("{\"quantity\": null}"))
                .isInstanceOf(InvalidNullException.class);
    }

    @Test
    @DisplayName("empty name and negative quantity fail bean validation on the offending field")
    void constraintsNameTheField() throws Exception {
        Set<ConstraintViolation<UpdateItemRequest>> violations =
                validator.validate(read("{\"name\": \"\", \"quantity\": -1}"));

        assertThat(violations.stream().map(violation -> violation.getPropertyPath().toString()))
                .containsExactlyInAnyOrder("name", "quantity");
    }

    private static UpdateItemRequest read(String json) throws Exception {
        return MAPPER.readValue(json, UpdateItemRequest.class);
    }
}
