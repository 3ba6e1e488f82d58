/*
 * Copyright (C) 2020 University of Dundee & Open Microscopy Environment.
 * All rights reserved.
 *
 * This program is free software; you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation; either version 2 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License along
 * with this program; if not, write to the Free Software Foundation, Inc.,
 * 51 Franklin Street, Fifth Floor, Boston, MA 02110-1301 USA.
 */

package org.openastronomy.ms.cutout;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import org.openastronomy.ms.cutout.dispatch.CanonicalParams;
import org.openastronomy.ms.cutout.dispatch.Dispatcher;
import org.openastronomy.ms.cutout.error.ImageNotFoundException;
import org.openastronomy.ms.cutout.error.RequestParseException;
import org.openastronomy.ms.cutout.error.TileIntegrityException;
import org.openastronomy.ms.cutout.getimage.Cancellation;
import org.openastronomy.ms.cutout.getimage.ImageGetter;
import org.openastronomy.ms.cutout.raster.Raster;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Run one image request against a tile store and write the encoded raster to a file.
 * A summary of the result is printed as JSON.
 */
public class CutoutCommand {

    private static final Logger LOGGER = LoggerFactory.getLogger(CutoutCommand.class);

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_BAD_REQUEST = 2;
    static final int EXIT_NOT_FOUND = 3;
    static final int EXIT_FAILURE = 4;

    private static void addOption(Options options, String opt, boolean required, String help) {
        final Option option = new Option(opt, true, help);
        option.setRequired(required);
        options.addOption(option);
    }

    private static Options getOptions() {
        final Options options = new Options();
        addOption(options, "config", false, "configuration properties file (optional)");
        addOption(options, "store", false, "tile store directory, overriding the configuration (optional)");
        addOption(options, "request", false, "JSON file of request parameters (optional)");
        addOption(options, "param", false, "request parameter as name=value, may be repeated (optional)");
        addOption(options, "out", true, "file to which to write the encoded raster (required)");
        return options;
    }

    /**
     * Gather request parameters from the request file then the individual parameters.
     * @param cmd the parsed command line
     * @return the request parameters
     * @throws IOException if the request file could not be read
     */
    private static Map<String, String> getParameters(CommandLine cmd) throws IOException {
        final Map<String, String> parameters = new HashMap<>();
        final String requestFile = cmd.getOptionValue("request");
        if (requestFile != null) {
            final JsonObject request;
            try {
                request = new JsonObject(new String(Files.readAllBytes(Paths.get(requestFile)), StandardCharsets.UTF_8));
            } catch (DecodeException de) {
                throw new RequestParseException("request file must hold a JSON object", de);
            }
            for (final Map.Entry<String, Object> parameter : request) {
                if (parameter.getValue() != null) {
                    parameters.put(parameter.getKey(), parameter.getValue().toString());
                }
            }
        }
        final String[] params = cmd.getOptionValues("param");
        if (params != null) {
            for (final String param : params) {
                final int equals = param.indexOf('=');
                if (equals < 1) {
                    throw new RequestParseException("parameter must be given as name=value, not " + param);
                }
                parameters.put(param.substring(0, equals), param.substring(equals + 1));
            }
        }
        return parameters;
    }

    /**
     * Build the configuration from system properties, the named configuration file and the store override.
     * @param cmd the parsed command line
     * @return the configuration
     * @throws IOException if the configuration file could not be read
     */
    private static Configuration getConfiguration(CommandLine cmd) throws IOException {
        final Properties properties = new Properties();
        properties.putAll(System.getProperties());
        final String configFile = cmd.getOptionValue("config");
        if (configFile != null) {
            CutoutService.loadProperties(properties, configFile);
        }
        final Map<String, String> configuration = new HashMap<>(Configuration.fromProperties(properties));
        final String store = cmd.getOptionValue("store");
        if (store != null) {
            configuration.put(Configuration.CONF_STORE_ROOT, store);
        }
        return new Configuration(configuration);
    }

    /**
     * Run the request given on the command line.
     * @param args the command-line arguments
     * @param out where to print the summary or the usage
     * @return the exit status
     */
    static int run(String[] args, PrintStream out) {
        final Options options = getOptions();
        final CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            out.println(e.getMessage());
            final String header = "Extract a cutout or mosaic from a tile store, selected by request parameters " +
                    "such as ds=calexp ra=37.64 dec=0.10 filter=r width=30 height=30 unit=arcsec.";
            new HelpFormatter().printHelp(new PrintWriter(out, true), HelpFormatter.DEFAULT_WIDTH, "CutoutCommand",
                    header, options, HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, "", true);
            return EXIT_USAGE;
        }
        CutoutService.Engine engine = null;
        try {
            final Map<String, String> parameters = getParameters(cmd);
            engine = new CutoutService.Engine(getConfiguration(cmd));
            final Dispatcher.Resolution resolution = engine.dispatcher.resolve(parameters);
            final CanonicalParams params = resolution.getParams();
            if (params.getDataset() == null) {
                throw new RequestParseException("must provide the ds parameter naming a dataset");
            }
            final ImageGetter imageGetter = engine.repository.getImageGetter(params.getDataset());
            if (imageGetter == null) {
                throw new ImageNotFoundException("no dataset " + params.getDataset());
            }
            final Raster raster = resolution.getOperation().apply(imageGetter, params, new Cancellation());
            final Buffer encoded = engine.encoder.encode(raster);
            final Path outPath = Paths.get(cmd.getOptionValue("out"));
            Files.write(outPath, encoded.getBytes());
            final JsonObject summary = new JsonObject()
                    .put("handler", resolution.getOperation().getHandlerName())
                    .put("dataset", params.getDataset())
                    .put("x", raster.getBounds().getX())
                    .put("y", raster.getBounds().getY())
                    .put("width", raster.getWidth())
                    .put("height", raster.getHeight())
                    .put("empty", raster.countEmpty())
                    .put("bytes", encoded.length())
                    .put("output", outPath.toString());
            out.println(summary.encode());
            return EXIT_SUCCESS;
        } catch (RequestParseException rpe) {
            out.println(new JsonObject().put("exception", rpe.getClass().getSimpleName()).put("message", rpe.getMessage()).encode());
            return EXIT_BAD_REQUEST;
        } catch (ImageNotFoundException infe) {
            out.println(new JsonObject().put("exception", infe.getClass().getSimpleName()).put("message", infe.getMessage()).encode());
            return EXIT_NOT_FOUND;
        } catch (TileIntegrityException | IOException e) {
            LOGGER.error("failed to serve request", e);
            out.println(new JsonObject().put("exception", e.getClass().getSimpleName()).put("message", e.getMessage()).encode());
            return EXIT_FAILURE;
        } finally {
            if (engine != null) {
                engine.close();
            }
        }
    }

    /**
     * Run one image request.
     * @param args the command-line arguments
     */
    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }
}
