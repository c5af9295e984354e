package com.optiongreeks.domain.model;

import com.optiongreeks.domain.enums.OptionStyle;
import com.optiongreeks.domain.enums.Side;
import com.optiongreeks.exception.GreeksException;
import com.optiongreeks.greeks.Greeks;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One option leg held by a strategy.
 *
 * <p>The wrapped {@link OptionContract} is shared, not copied: delta adjustments
 * change its quantity in place, so every holder of this position sees the new size.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Position implements Greeks {

    private String id;
    private OptionContract option;

    /** Premium per contract paid (long) or received (short). */
    private BigDecimal premium;

    private BigDecimal openFee;
    private BigDecimal closeFee;
    private LocalDateTime openedAt;

    /**
     * Exact match on strike, style and side. Strike uses compareTo so 95 and 95.00 match.
     */
    public boolean matches(BigDecimal strike, OptionStyle optionStyle, Side side) {
        return option != null
                && option.getOptionStyle() == optionStyle
                && option.getSide() == side
                && option.getStrikePrice().compareTo(strike) == 0;
    }

    public BigDecimal getQuantity() {
        return option != null ? option.getQuantity() : BigDecimal.ZERO;
    }

    @Override
    public List<OptionContract> getOptions() {
        if (option == null) {
            throw GreeksException.optionsRetrieval("position " + id, "no option attached");
        }
        return List.of(option);
    }
}
