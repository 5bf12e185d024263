/*-
 * #%L
 * This file is part of ExrView.
 * %%
 * Copyright (C) 2018 - 2020 QuPath developers, The University of Edinburgh
 * Copyright (C) 2024 ExrView developers
 * %%
 * ExrView is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * ExrView is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with ExrView.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */


package exrview;

import java.io.File;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import exrview.lib.common.Prefs;
import exrview.lib.common.ThreadPool;
import exrview.lib.common.ThreadTools;
import exrview.lib.images.BackgroundImagesLoader;
import exrview.lib.images.ChannelSelector;
import exrview.lib.images.Image;
import exrview.lib.io.GsonTools;
import exrview.logging.LogManager;
import exrview.logging.LogManager.LogLevel;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Main ExrView launcher.
 * <p>
 * Loads the requested images in the background, and prints a description of each as it becomes
 * available, in the order in which the images were given.
 */
@Command(name = "exrview", mixinStandardHelpOptions = true, versionProvider = ExrView.VersionProvider.class,
	description = "Load OpenEXR (and placeholder) images and describe their channels.",
	footer = {"", "Copyright(c) ExrView developers (2024)"})
public class ExrView implements Callable<Integer> {

	private static final Logger logger = LoggerFactory.getLogger(ExrView.class);

	@Spec
	private CommandSpec spec;

	@Parameters(arity = "1..*", paramLabel = "image", description = "Paths of the images to load.")
	private List<Path> paths = new ArrayList<>();

	@Option(names = {"-t", "--threads"}, description = "Number of worker threads (default = number of processors - 1).")
	private Integer nThreads;

	@Option(names = {"-c", "--channels"}, description = {"Channel selector.",
			"Comma-separated terms, matched as fuzzy subsequences of channel names; channels are ordered by the first term they match."},
			paramLabel = "selector")
	private String channels = "";

	@Option(names = {"--regex"}, description = "Interpret the channel selector as a regular expression.")
	private boolean regex;

	@Option(names = {"-l", "--log"}, description = {"Log level (default = INFO).", "Options: ${COMPLETION-CANDIDATES}"} )
	private LogLevel logLevel = LogLevel.INFO;

	@Option(names = {"--log-file"}, description = "Also write log messages to this file.", paramLabel = "file")
	private File logFile;

	@Option(names = {"--json"}, description = "Print a JSON summary of all images, instead of text.")
	private boolean json;

	/**
	 * Main class to launch ExrView.
	 *
	 * @param args
	 */
	public static void main(String[] args) {
		int exitCode = createCommandLine().execute(args);
		System.exit(exitCode);
	}

	/**
	 * Create the command line used by {@link #main(String[])}.
	 * @return
	 */
	static CommandLine createCommandLine() {
		CommandLine cmd = new CommandLine(new ExrView());
		cmd.setCaseInsensitiveEnumValuesAllowed(true);
		cmd.setExpandAtFiles(false);
		return cmd;
	}

	@Override
	public Integer call() throws Exception {
		if (logLevel != null)
			LogManager.setRootLogLevel(logLevel);
		if (logFile != null)
			LogManager.logToFile(logFile);

		if (nThreads != null) {
			if (nThreads < 1)
				throw new CommandLine.ParameterException(spec.commandLine(), "Number of threads must be at least 1, but was " + nThreads);
			Prefs.setNumThreads(nThreads);
		}

		PrintWriter out = spec.commandLine().getOut();
		var selector = ChannelSelector.create(channels, regex);
		List<Image> images = new ArrayList<>();
		int nLoaded = 0;

		try (var pool = new ThreadPool(ThreadTools.getParallelism())) {
			var loader = new BackgroundImagesLoader(pool);
			boolean first = true;
			for (Path path : paths) {
				loader.enqueue(path, selector, first);
				first = false;
			}
			boolean pending = true;
			while (pending) {
				loader.awaitPublished(1, TimeUnit.SECONDS);
				pending = loader.hasPendingLoads();
				for (var addition : loader.poll()) {
					nLoaded++;
					for (var image : addition.getImages()) {
						if (json)
							images.add(image);
						else
							out.println(image + "\n");
					}
				}
			}
		}

		if (json)
			out.println(GsonTools.getInstance(true).toJson(images));
		out.flush();

		if (nLoaded < paths.size()) {
			logger.warn("{} of {} images could not be loaded", paths.size() - nLoaded, paths.size());
			return 1;
		}
		return 0;
	}


	static class VersionProvider implements IVersionProvider {

		@Override
		public String[] getVersion() throws Exception {
			var version = ExrView.class.getPackage().getImplementationVersion();
			if (version == null)
				return new String[] {"Unknown ExrView version!"};
			if (!version.startsWith("v"))
				version = "v" + version;
			return new String[] {"ExrView " + version};
		}

	}

}
