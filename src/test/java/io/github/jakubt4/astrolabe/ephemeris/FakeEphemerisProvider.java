package io.github.jakubt4.astrolabe.ephemeris;

import io.github.jakubt4.astrolabe.model.UtInstant;
import io.github.jakubt4.astrolabe.zodiac.Longitudes;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic provider for tests: every body moves linearly from its J2000 mean longitude,
 * houses come from the real {@link HouseGeometry} fed with a linear sidereal time.
 *
 * <p>Failures can be scripted: {@link #failNextBodyCalls(int)} makes body calls throw,
 * {@link #failSiderealBodies()} makes every sidereal body call throw and
 * {@link #failSiderealHouses()} makes every sidereal house call throw.
 */
public class FakeEphemerisProvider implements EphemerisProvider {

    static final double OBLIQUITY = 23.4392911;

    private static final Map<EphemerisBody, double[]> MOTION = new EnumMap<>(EphemerisBody.class);

    static {
        // {longitude at J2000, degrees per day}
        MOTION.put(EphemerisBody.SUN, new double[]{280.46, 0.9856474});
        MOTION.put(EphemerisBody.MOON, new double[]{218.316, 13.176396});
        MOTION.put(EphemerisBody.MERCURY, new double[]{252.25, 4.0923344});
        MOTION.put(EphemerisBody.VENUS, new double[]{181.98, 1.6021302});
        MOTION.put(EphemerisBody.MARS, new double[]{355.43, 0.5240208});
        MOTION.put(EphemerisBody.JUPITER, new double[]{34.35, 0.0830853});
        MOTION.put(EphemerisBody.SATURN, new double[]{50.08, -0.0334442});
        MOTION.put(EphemerisBody.URANUS, new double[]{314.06, 0.0117281});
        MOTION.put(EphemerisBody.NEPTUNE, new double[]{304.35, 0.0059811});
        MOTION.put(EphemerisBody.PLUTO, new double[]{250.0, 0.0039700});
        MOTION.put(EphemerisBody.MEAN_NODE, new double[]{125.04, -0.0529538});
        MOTION.put(EphemerisBody.TRUE_NODE, new double[]{123.95, -0.0529538});
    }

    private CoordinateMode mode = CoordinateMode.TROPICAL;
    private int failingBodyCalls;
    private boolean failSiderealBodies;
    private boolean failSiderealHouses;
    private String dataPath;
    private final List<String> calls = new ArrayList<>();

    public FakeEphemerisProvider failNextBodyCalls(final int count) {
        this.failingBodyCalls = count;
        return this;
    }

    public FakeEphemerisProvider failSiderealBodies() {
        this.failSiderealBodies = true;
        return this;
    }

    public FakeEphemerisProvider failSiderealHouses() {
        this.failSiderealHouses = true;
        return this;
    }

    /** Every call made so far, as {@code "BODY:SIDEREAL"} or {@code "HOUSES:W:TROPICAL"}. */
    public List<String> calls() {
        return calls;
    }

    public String dataPath() {
        return dataPath;
    }

    public static double tropicalLongitude(final EphemerisBody body, final UtInstant instant) {
        final var motion = MOTION.get(body);
        return Longitudes.normalize(motion[0] + motion[1] * (instant.julianDay() - UtInstant.J2000.julianDay()));
    }

    @Override
    public double julianDay(final int year, final int month, final int day, final double hour,
                            final CalendarType calendar) {
        return JulianDays.of(year, month, day, hour, calendar);
    }

    @Override
    public BodyPosition calcBody(final UtInstant instant, final EphemerisBody body,
                                 final Set<CalculationFlag> flags) {
        final var sidereal = flags.contains(CalculationFlag.SIDEREAL);
        calls.add(body + ":" + (sidereal ? "SIDEREAL" : "TROPICAL"));
        if (failingBodyCalls > 0) {
            failingBodyCalls--;
            throw new ProviderCalculationException("Scripted failure for " + body);
        }
        if (sidereal && failSiderealBodies) {
            throw new ProviderCalculationException("Scripted sidereal failure for " + body);
        }
        final var shift = sidereal ? getCorrectionAngle(instant) : 0.0;
        final var speed = flags.contains(CalculationFlag.SPEED) ? MOTION.get(body)[1] : 0.0;
        return new BodyPosition(body, Longitudes.normalize(tropicalLongitude(body, instant) - shift), 0.0, 1.0, speed);
    }

    @Override
    public HouseCusps calcHouses(final UtInstant instant, final double latitude, final double longitude,
                                 final HouseSystem system, final Set<CalculationFlag> flags) {
        final var sidereal = flags.contains(CalculationFlag.SIDEREAL);
        calls.add("HOUSES:" + system.code() + ":" + (sidereal ? "SIDEREAL" : "TROPICAL"));
        if (sidereal && failSiderealHouses) {
            throw new ProviderCalculationException("Scripted sidereal house failure");
        }
        final var shift = sidereal ? getCorrectionAngle(instant) : 0.0;
        return HouseGeometry.compute(system, ramc(instant, longitude), OBLIQUITY, latitude, shift);
    }

    public static double ramc(final UtInstant instant, final double longitude) {
        final var days = instant.julianDay() - UtInstant.J2000.julianDay();
        return Longitudes.normalize(280.46061837 + 360.98564736629 * days + longitude);
    }

    @Override
    public void setCoordinateMode(final CoordinateMode mode) {
        this.mode = mode;
    }

    @Override
    public CoordinateMode getCoordinateMode() {
        return mode;
    }

    @Override
    public double getCorrectionAngle(final UtInstant instant) {
        if (!mode.sidereal()) {
            throw new ProviderCalculationException("Correction angle requested while in tropical mode");
        }
        return mode.method().correctionAngle(instant);
    }

    @Override
    public void setDataPath(final String path) {
        this.dataPath = path;
    }
}
