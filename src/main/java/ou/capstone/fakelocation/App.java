package ou.capstone.fakelocation;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.fakelocation.dialog.FavoritesField;
import ou.capstone.fakelocation.dialog.FavoritesInputState;
import ou.capstone.fakelocation.dialog.GoToPointField;
import ou.capstone.fakelocation.dialog.GoToPointState;
import ou.capstone.fakelocation.dialog.InputField;
import ou.capstone.fakelocation.event.Subscription;
import ou.capstone.fakelocation.exceptions.PreferencesException;
import ou.capstone.fakelocation.map.ControllerState;
import ou.capstone.fakelocation.map.MapController;
import ou.capstone.fakelocation.model.Coordinate;
import ou.capstone.fakelocation.model.FavoriteLocation;
import ou.capstone.fakelocation.persistence.JsonPreferencesRepository;
import ou.capstone.fakelocation.persistence.PreferencesRepository;
import ou.capstone.fakelocation.validation.InputValidator;

/**
 * Console driver for the map controller.
 *
 * Runs one map session against a JSON preferences file:
 * - restores the saved simulation state
 * - applies the requested action through the same dialog flows the map screen uses
 * - prints the outcome
 */
public final class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    private static ExitHandler exitHandler = new ExitHandler();

    public static void setExitHandler( final ExitHandler exitHandler )
    {
        App.exitHandler = exitHandler;
    }

    private App() {
        // Prevent instantiation
    }

    public static void main(final String[] args) throws ParseException {
        final Option prefsOption = Option.builder("p")
                .longOpt("prefs").hasArg()
                .desc("Preferences file (default: $" + SessionConfig.PREFS_FILE_ENV
                        + " or fake-location-prefs.json)").get();
        final Option gotoOption = Option.builder("g")
                .longOpt("goto")
                .desc("Move the map to --lat/--lon").get();
        final Option favoriteOption = Option.builder("f")
                .longOpt("favorite").hasArg()
                .desc("Save --lat/--lon as a favorite with the given name").get();
        final Option clickOption = Option.builder("c")
                .longOpt("click")
                .desc("Pick --lat/--lon as the simulated location").get();
        final Option toggleOption = Option.builder("t")
                .longOpt("toggle")
                .desc("Start or stop the location simulation").get();
        final Option listOption = Option.builder("l")
                .longOpt("list")
                .desc("Show simulation status and saved favorites").get();
        final Option latOption = Option.builder()
                .longOpt("lat").hasArg()
                .desc("Latitude in decimal degrees").get();
        final Option lonOption = Option.builder()
                .longOpt("lon").hasArg()
                .desc("Longitude in decimal degrees").get();
        final Option helpOption = Option.builder("h").longOpt("help")
                .desc("Display help").get();

        final Options options = new Options();
        options.addOption( prefsOption );
        options.addOption( gotoOption );
        options.addOption( favoriteOption );
        options.addOption( clickOption );
        options.addOption( toggleOption );
        options.addOption( listOption );
        options.addOption( latOption );
        options.addOption( lonOption );
        options.addOption( helpOption );

        final CommandLineParser cliParser = new DefaultParser();
        final CommandLine line;
        try {
            line = cliParser.parse(options, args);
        } catch (final ParseException e) {
            logger.error("Parsing args failed for reason: {}",
                    e.getMessage());
            throw e;
        }

        if (line.hasOption(helpOption) || line.getOptions().length == 0) {
            final HelpFormatter helpFormatter = HelpFormatter.builder().get();
            helpFormatter.printHelp("app",
                    "Fake location map options", options,
                    "Coordinates are decimal degrees; latitude -90..90, longitude -180..180.",
                    true);
            exitHandler.exit(0);
            return;
        }

        final boolean needsCoordinates = line.hasOption(gotoOption)
                || line.hasOption(favoriteOption) || line.hasOption(clickOption);
        if (needsCoordinates && (!line.hasOption(latOption) || !line.hasOption(lonOption))) {
            throw new ParseException("Invalid options: --lat and --lon are required with "
                    + "--goto, --favorite and --click");
        }

        SessionConfig config = SessionConfig.fromEnvironment();
        if (line.hasOption(prefsOption)) {
            config = config.withPreferencesFile(Path.of(line.getOptionValue(prefsOption)));
        }
        logger.info("Starting map session with {}", config);

        final PreferencesRepository preferences;
        try {
            preferences = new JsonPreferencesRepository(config.getPreferencesFile());
        } catch (final PreferencesException e) {
            logger.error("Could not load preferences: {}", e.getMessage());
            System.err.println("Preferences Error: " + e.getMessage());
            exitHandler.exit(1);
            return;
        }

        final String latitude = line.getOptionValue(latOption);
        final String longitude = line.getOptionValue(lonOption);

        try (MapController controller = new MapController(preferences)) {
            controller.restorePersistedState();
            controller.setLoadingFinished();

            if (line.hasOption(toggleOption)) {
                controller.togglePlaying();
                System.out.println("Simulation " + (controller.getState().playing() ? "started" : "stopped"));
            }

            if (line.hasOption(clickOption) && !pickLocation(controller, latitude, longitude)) {
                exitHandler.exit(1);
                return;
            }

            if (line.hasOption(gotoOption) && !goToPoint(controller, latitude, longitude, config)) {
                exitHandler.exit(1);
                return;
            }

            if (line.hasOption(favoriteOption)
                    && !addFavorite(controller, line.getOptionValue(favoriteOption), latitude, longitude)) {
                exitHandler.exit(1);
                return;
            }

            if (line.hasOption(listOption)) {
                displayStatus(controller.getState(), preferences.getFavorites());
            }

            logger.info("Map session completed successfully");
        } catch (final UncheckedIOException e) {
            logger.error("Storage error: {}", e.getMessage());
            System.err.println("\nStorage Error: " + e.getMessage());
            exitHandler.exit(1);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Interrupted while waiting for the map");
            exitHandler.exit(1);
        }
    }

    /**
     * Records the clicked location the simulation will report.
     *
     * @return false if the coordinates are not valid
     */
    private static boolean pickLocation(final MapController controller,
                                        final String latitude,
                                        final String longitude) {
        final List<String> errors = new ArrayList<>();
        addIfPresent(errors, InputValidator.validateLatitude(latitude));
        addIfPresent(errors, InputValidator.validateLongitude(longitude));
        if (!errors.isEmpty()) {
            printErrors("Invalid location", errors);
            return false;
        }
        controller.updateClickedLocation(new Coordinate(
                InputValidator.parseValidated(latitude), InputValidator.parseValidated(longitude)));
        System.out.println("Picked location " + controller.getState().lastClickedLocation());
        return true;
    }

    /**
     * Runs the "go to point" dialog flow and waits for the map to receive the event.
     *
     * @return false if the dialog rejected the input
     */
    private static boolean goToPoint(final MapController controller,
                                     final String latitude,
                                     final String longitude,
                                     final SessionConfig config) throws InterruptedException {
        final CountDownLatch delivered = new CountDownLatch(1);
        try (Subscription ignored = controller.goToPointEvents().subscribe(point -> {
            System.out.println("Map moved to " + point);
            delivered.countDown();
        })) {
            controller.showGoToPointDialog();
            controller.updateGoToPointField(GoToPointField.LATITUDE, latitude);
            controller.updateGoToPointField(GoToPointField.LONGITUDE, longitude);
            controller.validateAndGo((lat, lon) -> {
                controller.goToPoint(lat, lon);
                controller.clearGoToPointInputs();
                controller.hideGoToPointDialog();
            });

            final GoToPointState dialog = controller.getState().goToPoint();
            if (controller.getState().goToPointDialogVisible()) {
                final List<String> errors = new ArrayList<>();
                addIfPresent(errors, dialog.latitude().errorMessage());
                addIfPresent(errors, dialog.longitude().errorMessage());
                printErrors("Cannot go to point", errors);
                return false;
            }

            if (!delivered.await(config.getEventTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Map did not receive the go-to-point event within {} ms",
                        config.getEventTimeout().toMillis());
            }
            return true;
        }
    }

    /**
     * Runs the "add to favorites" dialog flow.
     *
     * @return false if the dialog rejected the input
     */
    private static boolean addFavorite(final MapController controller,
                                       final String name,
                                       final String latitude,
                                       final String longitude) {
        controller.showAddToFavoritesDialog();
        controller.updateAddToFavoritesField(FavoritesField.NAME, name);
        controller.updateAddToFavoritesField(FavoritesField.LATITUDE, latitude);
        controller.updateAddToFavoritesField(FavoritesField.LONGITUDE, longitude);
        controller.validateAndAddFavorite((favoriteName, lat, lon) -> {
            controller.addFavoriteLocation(new FavoriteLocation(favoriteName, lat, lon));
            controller.clearAddToFavoritesInputs();
            controller.hideAddToFavoritesDialog();
            System.out.println("Saved favorite '" + favoriteName + "'");
        });

        if (controller.getState().addToFavoritesDialogVisible()) {
            final FavoritesInputState dialog = controller.getState().favoritesInput();
            final List<String> errors = new ArrayList<>();
            for (FavoritesField field : FavoritesField.values()) {
                final InputField input = dialog.field(field);
                addIfPresent(errors, input.errorMessage());
            }
            printErrors("Cannot save favorite", errors);
            return false;
        }
        return true;
    }

    private static void displayStatus(final ControllerState state, final List<FavoriteLocation> favorites) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("Simulation: " + (state.playing() ? "ON" : "OFF"));
        System.out.println("Picked location: "
                + (state.isFabClickable() ? state.lastClickedLocation().toString() : "none"));
        System.out.println("=".repeat(60));
        if (favorites.isEmpty()) {
            System.out.println("No favorites saved.");
        } else {
            for (int i = 0; i < favorites.size(); i++) {
                System.out.println((i + 1) + ". " + favorites.get(i));
            }
        }
        System.out.println("=".repeat(60) + "\n");
    }

    private static void addIfPresent(final List<String> errors, final String error) {
        if (error != null) {
            errors.add(error);
        }
    }

    private static void printErrors(final String header, final List<String> errors) {
        logger.warn("{}: {}", header, errors);
        System.err.println(header + ":");
        for (String error : errors) {
            System.err.println("  - " + error);
        }
    }

    public static class ExitHandler
    {
        public void exit( final int code )
        {
            System.exit( code );
        }
    }
}
