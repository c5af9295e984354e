package com.optiongreeks.domain.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * One step of an {@link AdjustmentPlan}.
 *
 * <p>{@link ModifyQuantity} sets a held leg to an absolute quantity (zero closes it).
 * {@link AddUnderlying} trades shares of the underlying: positive buys, negative sells.
 */
public interface AdjustmentAction {

    record ModifyQuantity(int legIndex, String positionId, BigDecimal newQuantity) implements AdjustmentAction {

        public ModifyQuantity {
            Objects.requireNonNull(newQuantity, "newQuantity");
            if (newQuantity.signum() < 0) {
                throw new IllegalArgumentException("newQuantity must not be negative: " + newQuantity);
            }
        }

        @Override
        public String toString() {
            return "Modify leg " + legIndex + " (" + positionId + ") to quantity " + newQuantity.toPlainString();
        }
    }

    record AddUnderlying(BigDecimal quantity) implements AdjustmentAction {

        public AddUnderlying {
            Objects.requireNonNull(quantity, "quantity");
        }

        @Override
        public String toString() {
            return quantity.signum() >= 0
                    ? "Buy " + quantity.toPlainString() + " shares of underlying"
                    : "Sell " + quantity.abs().toPlainString() + " shares of underlying";
        }
    }
}
