package com.optiongreeks.greeks;

import static com.optiongreeks.core.math.DecimalMath.MC;

import com.optiongreeks.core.processor.GreeksCalculator;
import com.optiongreeks.domain.model.Greek;
import com.optiongreeks.domain.model.OptionContract;
import java.math.BigDecimal;
import java.util.List;
import java.util.function.Function;

/**
 * Capability of anything that holds option contracts: a single contract, a position,
 * or a multi-leg strategy.
 *
 * <p>Implementers only say which contracts they hold. Every Greek is then the sum of
 * the per-contract values, stopping at the first contract that fails. Alpha is the
 * exception: it is derived once from the aggregated gamma and theta so per-leg ratios
 * are never added together.
 */
public interface Greeks {

    /**
     * Lists the contracts to aggregate.
     *
     * @throws com.optiongreeks.exception.GreeksException with OPTIONS_RETRIEVAL when the
     *     holder has no usable legs
     */
    List<OptionContract> getOptions();

    default Greek greeks() {
        BigDecimal gamma = gamma();
        BigDecimal theta = theta();
        return Greek.builder()
                .delta(delta())
                .gamma(gamma)
                .theta(theta)
                .vega(vega())
                .rho(rho())
                .rhoD(rhoD())
                .alpha(alpha(gamma, theta))
                .build();
    }

    default BigDecimal delta() {
        return sum(GreeksCalculator::delta);
    }

    default BigDecimal gamma() {
        return sum(GreeksCalculator::gamma);
    }

    default BigDecimal theta() {
        return sum(GreeksCalculator::theta);
    }

    default BigDecimal vega() {
        return sum(GreeksCalculator::vega);
    }

    default BigDecimal rho() {
        return sum(GreeksCalculator::rho);
    }

    default BigDecimal rhoD() {
        return sum(GreeksCalculator::rhoD);
    }

    default BigDecimal alpha() {
        return alpha(gamma(), theta());
    }

    private BigDecimal sum(Function<OptionContract, BigDecimal> greek) {
        BigDecimal total = BigDecimal.ZERO;
        for (OptionContract option : getOptions()) {
            total = total.add(greek.apply(option), MC);
        }
        return total;
    }

    private static BigDecimal alpha(BigDecimal gamma, BigDecimal theta) {
        if (theta.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return gamma.divide(theta, MC);
    }
}
