package edu.harvard.hms.dbmi.avillach.kinetics.data.experiment;

import com.google.common.base.Preconditions;

import javax.annotation.Nonnull;
import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;

/**
 * A measured value, or an ordered series of values, tagged with its units. Units are kept exactly as the source document
 * wrote them; nothing here converts between unit systems.
 */
public final class Quantity implements Serializable {

    private static final long serialVersionUID = 3391254108861309927L;

    private final double[] values;
    private final String units;

    private Quantity(double[] values, String units) {
        Preconditions.checkArgument(values.length > 0, "A quantity needs at least one value");
        this.values = values;
        this.units = Objects.requireNonNull(units, "units");
    }

    public static Quantity of(double value, @Nonnull String units) {
        return new Quantity(new double[] {value}, units);
    }

    public static Quantity ofSeries(@Nonnull double[] values, @Nonnull String units) {
        return new Quantity(values.clone(), units);
    }

    public boolean isScalar() {
        return values.length == 1;
    }

    /**
     * @return the single value of a scalar quantity
     * @throws IllegalStateException if this quantity is a series of more than one value
     */
    public double getValue() {
        Preconditions.checkState(isScalar(), "Quantity holds %s values, not a single one", values.length);
        return values[0];
    }

    public double[] getValues() {
        return values.clone();
    }

    public int size() {
        return values.length;
    }

    /**
     * @return element {@code index} of the series as a scalar quantity in the same units
     */
    public Quantity get(int index) {
        Preconditions.checkElementIndex(index, values.length);
        return of(values[index], units);
    }

    public String getUnits() {
        return units;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Quantity quantity = (Quantity) o;
        return Arrays.equals(values, quantity.values) && units.equals(quantity.units);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(values) + units.hashCode();
    }

    @Override
    public String toString() {
        if (isScalar()) {
            return values[0] + " " + units;
        }
        return "[" + values.length + " values] " + units;
    }
}
