package com.optiongreeks.strategy.base;

import com.optiongreeks.domain.enums.OptionStyle;
import com.optiongreeks.domain.enums.Side;
import com.optiongreeks.domain.enums.StrategyType;
import com.optiongreeks.domain.model.OptionContract;
import com.optiongreeks.domain.model.Position;
import com.optiongreeks.exception.BusinessException;
import com.optiongreeks.exception.ErrorCode;
import com.optiongreeks.exception.GreeksException;
import com.optiongreeks.exception.ResourceNotFoundException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Abstract base class for all option strategies.
 *
 * <p>Provides the common infrastructure that every strategy needs:
 * <ul>
 *   <li><b>Position tracking:</b> Maintains the legs in insertion order. Leg order
 *       matters: delta adjustments walk the legs in this order.</li>
 *   <li><b>Shape validation:</b> Every added or replaced leg goes through
 *       {@link #validatePosition}, which each strategy type implements.</li>
 *   <li><b>Greeks and delta neutrality:</b> Inherited from {@link DeltaNeutrality}
 *       once {@link #getOptions()} lists the legs.</li>
 *   <li><b>Leg construction:</b> {@link #open()} prices the legs returned by
 *       {@link #buildLegs()} off the shared {@link StrategyConfig}.</li>
 * </ul>
 *
 * <p>Not thread-safe. A strategy and its positions belong to a single caller.
 */
public abstract class BaseStrategy implements DeltaNeutrality {

    private static final Logger log = LoggerFactory.getLogger(BaseStrategy.class);

    // ---- Identity ----
    protected final String id;
    protected final String name;
    protected final StrategyConfig config;

    // ---- State ----
    protected BigDecimal underlyingPrice;
    protected final List<Position> positions = new ArrayList<>();

    protected BaseStrategy(String id, String name, StrategyConfig config) {
        this.id = id;
        this.name = name;
        this.config = config;
        this.underlyingPrice = config.getUnderlyingPrice();
    }

    // ========================
    // ABSTRACT METHODS (each strategy type implements these)
    // ========================

    @Override
    public abstract StrategyType getType();

    /**
     * Rejects a leg that does not fit the strategy shape.
     *
     * @param candidate the leg being added or replacing an existing one
     * @param others every other leg currently held
     * @throws BusinessException if the leg breaks the shape
     */
    protected abstract void validatePosition(Position candidate, List<Position> others);

    /** Legs to open at the configured underlying price. */
    protected abstract List<Position> buildLegs();

    // ========================
    // IDENTITY
    // ========================

    public String getId() {
        return id;
    }

    @Override
    public String getName() {
        return name;
    }

    public StrategyConfig getConfig() {
        return config;
    }

    public String getUnderlying() {
        return config.getUnderlying();
    }

    @Override
    public BigDecimal getUnderlyingPrice() {
        return underlyingPrice;
    }

    /**
     * Moves the underlying and reprices every leg against it. The next delta
     * evaluation sees the new price.
     */
    public void setUnderlyingPrice(BigDecimal underlyingPrice) {
        if (underlyingPrice == null || underlyingPrice.signum() <= 0) {
            throw GreeksException.invalidPrice(underlyingPrice);
        }
        BigDecimal previous = this.underlyingPrice;
        this.underlyingPrice = underlyingPrice;
        positions.forEach(p -> p.getOption().setUnderlyingPrice(underlyingPrice));
        log.debug("{} underlying moved {} -> {} across {} legs", name, previous, underlyingPrice, positions.size());
    }

    // ========================
    // LIFECYCLE
    // ========================

    /**
     * Opens the strategy's legs. Only valid while the strategy holds nothing.
     *
     * @throws BusinessException if legs are already held
     */
    public void open() {
        if (!positions.isEmpty()) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    "Strategy " + name + " already holds " + positions.size() + " legs",
                    Map.of("strategyId", id));
        }
        List<Position> legs = buildLegs();
        legs.forEach(this::addPosition);
        log.info("Opened {} ({}) with {} legs around {}", name, getType(), legs.size(), underlyingPrice);
    }

    // ========================
    // GREEKS
    // ========================

    @Override
    public List<OptionContract> getOptions() {
        if (positions.isEmpty()) {
            throw GreeksException.optionsRetrieval(name, "strategy holds no positions");
        }
        return positions.stream().map(Position::getOption).toList();
    }

    // ========================
    // POSITION TRACKING
    // ========================

    @Override
    public List<Position> getPositions() {
        return List.copyOf(positions);
    }

    @Override
    public List<Position> getPosition(OptionStyle optionStyle, Side side, BigDecimal strike) {
        return positions.stream().filter(p -> p.matches(strike, optionStyle, side)).toList();
    }

    @Override
    public void addPosition(Position position) {
        checkLeg(position);
        if (positions.stream().anyMatch(p -> p.getId().equals(position.getId()))) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    "Position " + position.getId() + " already exists in " + name,
                    Map.of("positionId", position.getId()));
        }
        validatePosition(position, getPositions());
        positions.add(position);
        log.debug("Added {} to {}", describe(position), name);
    }

    @Override
    public void modifyPosition(Position position) {
        checkLeg(position);
        int index = indexOf(position.getId());
        List<Position> others = new ArrayList<>(positions);
        others.remove(index);
        validatePosition(position, others);
        positions.set(index, position);
        log.debug("Replaced position {} in {} with {}", position.getId(), name, describe(position));
    }

    @Override
    public void removePosition(String positionId) {
        positions.remove(indexOf(positionId));
        log.debug("Removed position {} from {}", positionId, name);
    }

    private int indexOf(String positionId) {
        for (int i = 0; i < positions.size(); i++) {
            if (positions.get(i).getId().equals(positionId)) {
                return i;
            }
        }
        throw new ResourceNotFoundException("Position", positionId);
    }

    private void checkLeg(Position position) {
        if (position == null || position.getId() == null) {
            throw new BusinessException("Position and its id are required");
        }
        OptionContract option = position.getOption();
        if (option == null
                || option.getStrikePrice() == null
                || option.getOptionStyle() == null
                || option.getSide() == null) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    "Position " + position.getId() + " needs an option with strike, style and side",
                    Map.of("positionId", position.getId()));
        }
        if (option.getQuantity() == null || option.getQuantity().signum() < 0) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    "Position " + position.getId() + " has invalid quantity " + option.getQuantity(),
                    Map.of("positionId", position.getId()));
        }
    }

    // ========================
    // LEG CONSTRUCTION HELPERS (used by subclasses in buildLegs)
    // ========================

    /** Builds one leg priced off the config at the current underlying price. */
    protected Position leg(BigDecimal strike, OptionStyle optionStyle, Side side) {
        OptionContract option = OptionContract.builder()
                .underlyingSymbol(config.getUnderlying())
                .underlyingPrice(underlyingPrice)
                .strikePrice(strike)
                .riskFreeRate(config.getRiskFreeRate())
                .expiration(config.getExpiration())
                .impliedVolatility(config.getImpliedVolatility())
                .dividendYield(config.getDividendYield())
                .optionStyle(optionStyle)
                .quantity(config.getQuantity())
                .side(side)
                .build();

        return Position.builder()
                .id(String.format("%s-%s-%s-%s", id, side, optionStyle, strike.toPlainString()))
                .option(option)
                .openedAt(LocalDateTime.now())
                .build();
    }

    /** ATM strike: the underlying rounded to the configured strike interval. */
    protected BigDecimal atmStrike() {
        return roundToStrike(underlyingPrice);
    }

    /**
     * Rounds a price to the nearest valid strike based on the strike interval.
     * Example: roundToStrike(452.3) with interval 5 = 450.
     */
    protected BigDecimal roundToStrike(BigDecimal price) {
        BigDecimal interval = config.getStrikeInterval();
        if (interval == null || interval.signum() == 0) return price;
        return price.divide(interval, 0, RoundingMode.HALF_UP).multiply(interval);
    }

    /** Offset from ATM, treating a missing offset as zero. */
    protected BigDecimal atmPlus(BigDecimal offset) {
        return offset == null ? atmStrike() : atmStrike().add(offset);
    }

    // ========================
    // VALIDATION HELPERS (used by subclasses in validatePosition)
    // ========================

    protected static Optional<Position> find(List<Position> legs, OptionStyle optionStyle, Side side) {
        return legs.stream()
                .filter(p -> p.getOption().getOptionStyle() == optionStyle
                        && p.getOption().getSide() == side)
                .findFirst();
    }

    /** Fails with a VALIDATION_ERROR naming the rejected leg when {@code condition} is false. */
    protected void require(boolean condition, String reason, Position candidate) {
        if (!condition) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR,
                    getType() + " " + name + " rejects " + describe(candidate) + ": " + reason,
                    Map.of("positionId", candidate.getId(), "strategyType", getType().name()));
        }
    }

    /** At most one leg per (style, side) pair. */
    protected void requireUnique(Position candidate, List<Position> others) {
        OptionContract option = candidate.getOption();
        require(
                find(others, option.getOptionStyle(), option.getSide()).isEmpty(),
                "already holds a " + option.getSide() + " " + option.getOptionStyle(),
                candidate);
    }

    protected static String describe(Position position) {
        OptionContract option = position.getOption();
        return option.getSide() + " " + option.getOptionStyle() + " " + option.getStrikePrice().toPlainString()
                + " x" + option.getQuantity().toPlainString();
    }

    @Override
    public String toString() {
        return getType() + "[" + name + ", legs=" + positions.size() + "]";
    }
}
