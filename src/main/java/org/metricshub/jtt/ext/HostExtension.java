package org.metricshub.jtt.ext;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jtt
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.Objects;
import org.metricshub.jtt.ExitException;
import org.metricshub.jtt.backend.Evaluator;
import org.metricshub.jtt.jrt.ErrorKind;
import org.metricshub.jtt.jrt.EvaluationException;
import org.metricshub.jtt.util.JttLogger;
import org.slf4j.Logger;

/**
 * Commands that talk to the host: {@code print}, {@code system} and
 * {@code exit}.
 */
public class HostExtension implements JttExtension {

	private static final Logger LOG = JttLogger.getLogger(HostExtension.class);

	private static final boolean IS_WINDOWS = System.getProperty("os.name").indexOf("Windows") >= 0;

	private final PrintStream out;

	/**
	 * @param out stream receiving {@code print} output and the output of
	 *        {@code system} commands
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public HostExtension(PrintStream out) {
		this.out = Objects.requireNonNull(out, "out");
	}

	@Override
	public String getExtensionName() {
		return "Host";
	}

	@Override
	public void install(CommandRegistry registry) {
		registry.register("print", this::print);
		registry.register("system", this::system);
		registry.register("exit", this::exit);
	}

	/**
	 * Writes the stack, top first, to the output stream.
	 *
	 * @param evaluator evaluator to print
	 */
	protected void print(Evaluator evaluator) {
		try {
			evaluator.printData(out);
		} catch (IOException e) {
			throw new EvaluationException(ErrorKind.HOST_FAILURE, "Cannot print stack: " + e.getMessage(), e);
		}
		out.flush();
	}

	/**
	 * Runs the text of the top leaf as a shell command, then pops the leaf.
	 * The command's stdout and stderr are copied to the output stream.
	 *
	 * @param evaluator evaluator holding the command leaf
	 */
	protected void system(Evaluator evaluator) {
		String cmd = evaluator.getData().peekLeaf().getText();
		try {
			Process p = spawnProcess(cmd);
			// no input to this process!
			p.getOutputStream().close();
			try (InputStream in = p.getInputStream()) {
				pump(in, out);
			}
			int retcode = p.waitFor();
			LOG.debug("'{}' exited with code {}", cmd, retcode);
		} catch (IOException e) {
			throw new EvaluationException(ErrorKind.HOST_FAILURE, "Cannot run '" + cmd + "': " + e.getMessage(), e);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new EvaluationException(ErrorKind.HOST_FAILURE, "Interrupted while running '" + cmd + "'", e);
		}
		evaluator.getData().pop();
	}

	/**
	 * Requests the end of the read loop. The session ends normally, so the
	 * exit code is 0.
	 *
	 * @param evaluator unused
	 */
	protected void exit(Evaluator evaluator) {
		throw new ExitException(0);
	}

	/**
	 * Copies the process output until end of stream.
	 *
	 * @param in process output
	 * @param dest destination stream
	 * @throws IOException when reading fails
	 */
	private static void pump(InputStream in, PrintStream dest) throws IOException {
		byte[] buffer = new byte[4096];
		int len;
		while ((len = in.read(buffer)) >= 0) {
			dest.write(buffer, 0, len);
		}
		dest.flush();
	}

	private static Process spawnProcess(String cmd) throws IOException {
		ProcessBuilder pb;
		if (IS_WINDOWS) {
			// spawn the process using the Windows shell
			pb = new ProcessBuilder("cmd.exe", "/c", cmd);
		} else {
			// spawn the process using the default POSIX shell
			pb = new ProcessBuilder("/bin/sh", "-c", cmd);
		}
		pb.redirectErrorStream(true);
		return pb.start();
	}
}
