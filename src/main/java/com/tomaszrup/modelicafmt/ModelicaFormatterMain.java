////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.modelicafmt;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.modelicafmt.formatter.FormatterConfig;
import com.tomaszrup.modelicafmt.formatter.ModelicaFormatter;
import com.tomaszrup.modelicafmt.parser.ModelicaSyntaxException;
import com.tomaszrup.modelicafmt.util.MdcDocumentContext;

/**
 * Command-line front end.
 *
 * <pre>
 * modelicafmt [-w] [-line-length N] [-emptyLines=BOOL] &lt;file|dir&gt;...
 * modelicafmt --lsp [--tcp PORT]
 * </pre>
 */
public final class ModelicaFormatterMain {
	private static final Logger logger = LoggerFactory.getLogger(ModelicaFormatterMain.class);

	static final int EXIT_OK = 0;
	static final int EXIT_FAILURE = 1;
	static final int EXIT_USAGE = 2;

	static final String MODELICA_EXTENSION = ".mo";

	static final String USAGE = String.join(System.lineSeparator(),
			"usage: modelicafmt [-w] [-line-length N] [-emptyLines=BOOL] <file|dir>...",
			"       modelicafmt --lsp [--tcp PORT]",
			"",
			"  -w                 write the result back to each file instead of stdout",
			"  -line-length N     maximum line length, 0 disables wrapping (default "
					+ FormatterConfig.DEFAULT_MAX_LINE_LENGTH + ")",
			"  -emptyLines=BOOL   insert a blank line between statements (default "
					+ FormatterConfig.DEFAULT_EMPTY_LINES + ")",
			"  --lsp              run as a language server (stdio, or a local TCP port)",
			"  -h, --help         print this help");

	private ModelicaFormatterMain() {
	}

	public static void main(String[] args) throws IOException {
		if (args.length > 0 && "--lsp".equals(args[0])) {
			ModelicaLanguageServer.main(Arrays.copyOfRange(args, 1, args.length));
			return;
		}
		System.exit(run(args, System.out, System.err));
	}

	/** Parsed command line. */
	static final class Options {
		boolean write;
		boolean help;
		FormatterConfig config = FormatterConfig.defaults();
		final List<Path> targets = new ArrayList<>();
	}

	static final class UsageException extends Exception {
		private static final long serialVersionUID = 1L;

		UsageException(String message) {
			super(message);
		}
	}

	static Options parseArguments(String[] args) throws UsageException {
		Options options = new Options();
		for (int i = 0; i < args.length; i++) {
			String arg = args[i];
			if ("-h".equals(arg) || "--help".equals(arg) || "-help".equals(arg)) {
				options.help = true;
			} else if ("-w".equals(arg)) {
				options.write = true;
			} else if ("-line-length".equals(arg)) {
				if (i + 1 >= args.length) {
					throw new UsageException("-line-length requires a value");
				}
				options.config = options.config.withMaxLineLength(parseLineLength(args[++i]));
			} else if (arg.startsWith("-line-length=")) {
				options.config = options.config.withMaxLineLength(
						parseLineLength(arg.substring("-line-length=".length())));
			} else if ("-emptyLines".equals(arg)) {
				options.config = options.config.withEmptyLines(true);
			} else if (arg.startsWith("-emptyLines=")) {
				options.config = options.config.withEmptyLines(
						parseBoolean(arg.substring("-emptyLines=".length())));
			} else if (arg.startsWith("-") && arg.length() > 1) {
				throw new UsageException("unknown flag: " + arg);
			} else {
				options.targets.add(Paths.get(arg));
			}
		}
		return options;
	}

	private static int parseLineLength(String value) throws UsageException {
		try {
			int length = Integer.parseInt(value);
			if (length < 0) {
				throw new UsageException("-line-length must not be negative: " + value);
			}
			return length;
		} catch (NumberFormatException e) {
			throw new UsageException("invalid -line-length: " + value);
		}
	}

	private static boolean parseBoolean(String value) throws UsageException {
		if ("true".equalsIgnoreCase(value) || "1".equals(value)) {
			return true;
		}
		if ("false".equalsIgnoreCase(value) || "0".equals(value)) {
			return false;
		}
		throw new UsageException("invalid boolean value: " + value);
	}

	/**
	 * Formats every target and returns the process exit status.
	 */
	static int run(String[] args, PrintStream out, PrintStream err) {
		Options options;
		try {
			options = parseArguments(args);
		} catch (UsageException e) {
			err.println("modelicafmt: " + e.getMessage());
			err.println(USAGE);
			return EXIT_USAGE;
		}
		if (options.help) {
			out.println(USAGE);
			return EXIT_OK;
		}
		if (options.targets.isEmpty()) {
			err.println("modelicafmt: no input files");
			err.println(USAGE);
			return EXIT_USAGE;
		}

		ModelicaFormatter formatter = new ModelicaFormatter(options.config);
		boolean failed = false;
		for (Path target : options.targets) {
			List<Path> files;
			try {
				files = collectFiles(target);
			} catch (IOException e) {
				err.println("modelicafmt: " + target + ": " + e.getMessage());
				logger.debug("Cannot list {}", target, e);
				failed = true;
				continue;
			}
			for (Path file : files) {
				if (!formatFile(formatter, file, options.write, out, err)) {
					failed = true;
				}
			}
		}
		return failed ? EXIT_FAILURE : EXIT_OK;
	}

	/**
	 * A regular file is returned as is; a directory is searched recursively for
	 * {@value #MODELICA_EXTENSION} files, in path order.
	 */
	static List<Path> collectFiles(Path target) throws IOException {
		if (!Files.isDirectory(target)) {
			if (!Files.exists(target)) {
				throw new IOException("no such file or directory");
			}
			return List.of(target);
		}
		try (Stream<Path> walk = Files.walk(target)) {
			return walk.filter(Files::isRegularFile)
					.filter(p -> p.getFileName().toString().endsWith(MODELICA_EXTENSION))
					.sorted()
					.collect(Collectors.toList());
		}
	}

	private static boolean formatFile(ModelicaFormatter formatter, Path file, boolean write, PrintStream out,
			PrintStream err) {
		MdcDocumentContext.setDocument(file.toString());
		try {
			String source = Files.readString(file, StandardCharsets.UTF_8);
			String formatted = formatter.format(source, file.toString());
			if (!write) {
				out.print(formatted);
			} else if (!formatted.equals(source)) {
				Files.writeString(file, formatted, StandardCharsets.UTF_8);
				logger.info("Formatted {}", file);
			} else {
				logger.debug("{} already formatted", file);
			}
			return true;
		} catch (ModelicaSyntaxException e) {
			err.println("modelicafmt: " + e.getMessage());
			logger.debug("Syntax error in {}", file, e);
			return false;
		} catch (IOException e) {
			err.println("modelicafmt: " + file + ": " + e.getMessage());
			logger.debug("I/O error on {}", file, e);
			return false;
		} finally {
			MdcDocumentContext.clear();
		}
	}
}
