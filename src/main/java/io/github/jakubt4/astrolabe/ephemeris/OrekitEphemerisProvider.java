package io.github.jakubt4.astrolabe.ephemeris;

import io.github.jakubt4.astrolabe.model.UtInstant;
import io.github.jakubt4.astrolabe.zodiac.Longitudes;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.geometry.euclidean.threed.Vector3D;
import org.hipparchus.util.FastMath;
import org.orekit.bodies.CelestialBody;
import org.orekit.data.DataContext;
import org.orekit.data.LazyLoadedDataContext;
import org.orekit.errors.OrekitException;
import org.orekit.frames.Frame;
import org.orekit.time.AbsoluteDate;
import org.orekit.utils.Constants;
import org.orekit.utils.IERSConventions;
import org.orekit.utils.PVCoordinates;

import java.time.Instant;
import java.util.Date;
import java.util.Set;

/**
 * {@link EphemerisProvider} backed by Orekit and the JPL DE ephemerides found in the Orekit
 * data context.
 *
 * <p>Body positions are geocentric and referred to the mean ecliptic and equinox of date
 * (tropical). Sidereal longitudes subtract the correction angle of the active
 * {@link SiderealMethod}. House frames are built from Greenwich mean sidereal time and the
 * IERS 2010 mean obliquity. UT is taken as UTC: the sub-second UT1-UTC difference is far below
 * the arc-minute resolution of every downstream subdivision.
 *
 * <p>Instances carry mutable coordinate mode and are not thread-safe; obtain one per
 * computation from {@link OrekitEphemerisProviderFactory}.
 */
@Slf4j
public class OrekitEphemerisProvider implements EphemerisProvider {

    private static final double UNIX_EPOCH_JULIAN_DAY = 2440587.5;
    private static final double MILLIS_PER_DAY = Constants.JULIAN_DAY * 1000.0;
    private static final double TRUE_NODE_SPEED_STEP_SECONDS = 3600.0;
    private static final IERSConventions CONVENTIONS = IERSConventions.IERS_2010;

    private final LazyLoadedDataContext dataContext;
    private CoordinateMode mode = CoordinateMode.TROPICAL;

    public OrekitEphemerisProvider(final LazyLoadedDataContext dataContext) {
        this.dataContext = dataContext;
    }

    @Override
    public double julianDay(final int year, final int month, final int day, final double hour,
                            final CalendarType calendar) {
        return JulianDays.of(year, month, day, hour, calendar);
    }

    @Override
    public BodyPosition calcBody(final UtInstant instant, final EphemerisBody body,
                                 final Set<CalculationFlag> flags) {
        final var shift = siderealShift(instant, flags);
        final var withSpeed = flags.contains(CalculationFlag.SPEED);
        try {
            final var tropical = switch (body) {
                case MEAN_NODE -> meanNode(instant, withSpeed);
                case TRUE_NODE -> trueNode(toDate(instant), withSpeed);
                default -> planet(body, toDate(instant), withSpeed);
            };
            return new BodyPosition(body,
                    Longitudes.normalize(tropical.longitude() - shift),
                    tropical.latitude(),
                    tropical.distance(),
                    tropical.longitudeSpeed());
        } catch (final OrekitException e) {
            throw new ProviderCalculationException(
                    "Ephemeris calculation failed for " + body + " at JD " + instant.julianDay() + ": "
                            + e.getMessage(), e);
        }
    }

    @Override
    public HouseCusps calcHouses(final UtInstant instant, final double latitude, final double longitude,
                                 final HouseSystem system, final Set<CalculationFlag> flags) {
        final var shift = siderealShift(instant, flags);
        try {
            final var date = toDate(instant);
            final var timeScales = dataContext.getTimeScales();
            final var ut1 = timeScales.getUT1(CONVENTIONS, true);
            final var gmst = FastMath.toDegrees(CONVENTIONS.getGMSTFunction(ut1, timeScales).value(date));
            final var obliquity = FastMath.toDegrees(CONVENTIONS.getMeanObliquityFunction(timeScales).value(date));
            final var ramc = Longitudes.normalize(gmst + longitude);
            return HouseGeometry.compute(system, ramc, obliquity, latitude, shift);
        } catch (final OrekitException e) {
            throw new ProviderCalculationException(
                    "House calculation (" + system.code() + ") failed at JD " + instant.julianDay() + ": "
                            + e.getMessage(), e);
        }
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

    /**
     * Replaces the data providers of this provider's own data context.
     *
     * <p>Providers from {@link OrekitEphemerisProviderFactory} share the default Orekit context,
     * which is configured once at startup from {@code astrolabe.ephemeris.data-path}; re-pointing
     * it from one computation would affect every other one, so it is refused here.
     *
     * @throws IllegalStateException if this provider runs on the shared default context
     */
    @Override
    public void setDataPath(final String path) {
        if (dataContext == DataContext.getDefault()) {
            throw new IllegalStateException(
                    "Data path of the shared Orekit context is set at startup via astrolabe.ephemeris.data-path");
        }
        OrekitDataPaths.register(dataContext.getDataProvidersManager(), path);
    }

    private double siderealShift(final UtInstant instant, final Set<CalculationFlag> flags) {
        return flags.contains(CalculationFlag.SIDEREAL) ? getCorrectionAngle(instant) : 0.0;
    }

    private AbsoluteDate toDate(final UtInstant instant) {
        final var epochMillis = Math.round((instant.julianDay() - UNIX_EPOCH_JULIAN_DAY) * MILLIS_PER_DAY);
        return new AbsoluteDate(Date.from(Instant.ofEpochMilli(epochMillis)),
                dataContext.getTimeScales().getUTC());
    }

    private Frame eclipticOfDate() {
        return dataContext.getFrames().getEcliptic(CONVENTIONS);
    }

    private BodyPosition planet(final EphemerisBody body, final AbsoluteDate date, final boolean withSpeed) {
        final var pv = celestialBody(body).getPVCoordinates(date, eclipticOfDate());
        return fromCartesian(body, pv, withSpeed);
    }

    /**
     * Osculating ascending node of the lunar orbit: the ecliptic direction of the line
     * {@code z × (r × v)}.
     */
    private BodyPosition trueNode(final AbsoluteDate date, final boolean withSpeed) {
        final var longitude = trueNodeLongitude(date);
        var speed = 0.0;
        if (withSpeed) {
            final var before = trueNodeLongitude(date.shiftedBy(-TRUE_NODE_SPEED_STEP_SECONDS));
            final var after = trueNodeLongitude(date.shiftedBy(TRUE_NODE_SPEED_STEP_SECONDS));
            var delta = after - before;
            if (delta > 180.0) {
                delta -= 360.0;
            } else if (delta < -180.0) {
                delta += 360.0;
            }
            speed = delta * Constants.JULIAN_DAY / (2 * TRUE_NODE_SPEED_STEP_SECONDS);
        }
        return new BodyPosition(EphemerisBody.TRUE_NODE, longitude, 0.0, 0.0, speed);
    }

    private double trueNodeLongitude(final AbsoluteDate date) {
        final var pv = dataContext.getCelestialBodies().getMoon().getPVCoordinates(date, eclipticOfDate());
        final var momentum = pv.getMomentum();
        return Longitudes.normalize(FastMath.toDegrees(FastMath.atan2(momentum.getX(), -momentum.getY())));
    }

    /**
     * Mean ascending node of the Moon (Meeus, <i>Astronomical Algorithms</i>, eq. 47.7).
     */
    private static BodyPosition meanNode(final UtInstant instant, final boolean withSpeed) {
        final var t = instant.centuriesSinceJ2000();
        final var longitude = 125.0445479 - 1934.1362891 * t + 0.0020754 * t * t
                + t * t * t / 467441.0 - t * t * t * t / 60616000.0;
        var speed = 0.0;
        if (withSpeed) {
            final var perCentury = -1934.1362891 + 2 * 0.0020754 * t
                    + 3 * t * t / 467441.0 - 4 * t * t * t / 60616000.0;
            speed = perCentury / 36525.0;
        }
        return new BodyPosition(EphemerisBody.MEAN_NODE, Longitudes.normalize(longitude), 0.0, 0.0, speed);
    }

    private static BodyPosition fromCartesian(final EphemerisBody body, final PVCoordinates pv,
                                              final boolean withSpeed) {
        final Vector3D position = pv.getPosition();
        final var longitude = FastMath.toDegrees(FastMath.atan2(position.getY(), position.getX()));
        final var latitude = FastMath.toDegrees(FastMath.asin(position.getZ() / position.getNorm()));
        final var distance = position.getNorm() / Constants.IAU_2012_ASTRONOMICAL_UNIT;
        var speed = 0.0;
        if (withSpeed) {
            final Vector3D velocity = pv.getVelocity();
            final var planar = position.getX() * position.getX() + position.getY() * position.getY();
            final var radiansPerSecond = (position.getX() * velocity.getY() - position.getY() * velocity.getX()) / planar;
            speed = FastMath.toDegrees(radiansPerSecond) * Constants.JULIAN_DAY;
        }
        return new BodyPosition(body, Longitudes.normalize(longitude), latitude, distance, speed);
    }

    private CelestialBody celestialBody(final EphemerisBody body) {
        final var bodies = dataContext.getCelestialBodies();
        return switch (body) {
            case SUN -> bodies.getSun();
            case MOON -> bodies.getMoon();
            case MERCURY -> bodies.getMercury();
            case VENUS -> bodies.getVenus();
            case MARS -> bodies.getMars();
            case JUPITER -> bodies.getJupiter();
            case SATURN -> bodies.getSaturn();
            case URANUS -> bodies.getUranus();
            case NEPTUNE -> bodies.getNeptune();
            case PLUTO -> bodies.getPluto();
            case MEAN_NODE, TRUE_NODE -> throw new IllegalArgumentException(body + " is not a celestial body");
        };
    }
}
