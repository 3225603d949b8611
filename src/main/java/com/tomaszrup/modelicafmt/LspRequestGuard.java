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

import java.net.URI;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.modelicafmt.parser.ModelicaSyntaxException;

/**
 * Fail-soft execution of LSP requests: a failing request is logged and
 * answered with a fallback value instead of an error response.
 *
 * <p>A document that does not parse is an expected state while the user is
 * typing and is logged at {@code info} with its position. Any other failure is
 * logged at {@code warn}, with the stack trace at {@code debug}. Only
 * {@link VirtualMachineError}s propagate.</p>
 */
class LspRequestGuard {
	private static final Logger logger = LoggerFactory.getLogger(LspRequestGuard.class);

	/** Where the failure surfaced: while building the future, or in the future itself. */
	enum Stage {
		SYNC,
		ASYNC
	}

	<T> CompletableFuture<T> failSoftRequest(String requestName, URI uri,
			Supplier<CompletableFuture<T>> requestCall, T fallbackValue) {
		CompletableFuture<T> future;
		try {
			future = requestCall.get();
		} catch (RuntimeException | LinkageError e) {
			recover(requestName, uri, e, Stage.SYNC);
			return CompletableFuture.completedFuture(fallbackValue);
		}
		if (future == null) {
			return CompletableFuture.completedFuture(fallbackValue);
		}
		return future.exceptionally(throwable -> {
			recover(requestName, uri, throwable, Stage.ASYNC);
			return fallbackValue;
		});
	}

	/**
	 * Logs a failed request, or rethrows the failure when the JVM itself is in
	 * trouble.
	 */
	void recover(String requestName, URI uri, Throwable throwable, Stage stage) {
		Throwable root = unwrapRequestThrowable(throwable);
		if (isFatalRequestThrowable(root)) {
			throwAsUnchecked(root);
		}
		if (root instanceof ModelicaSyntaxException) {
			ModelicaSyntaxException syntaxError = (ModelicaSyntaxException) root;
			logger.info("{} skipped, {} does not parse at {}:{}", requestName, uri, syntaxError.getLine(),
					syntaxError.getColumn());
			return;
		}
		if (logger.isWarnEnabled()) {
			logger.warn("{} request failed ({}), uri={}, error={}", requestName, stage, uri,
					summarizeThrowable(root));
		}
		logger.debug("{} request failure details", requestName, root);
	}

	static String summarizeThrowable(Throwable throwable) {
		if (throwable == null) {
			return "<null>";
		}
		String message = throwable.getMessage();
		if (message == null || message.isBlank()) {
			return throwable.getClass().getName();
		}
		return throwable.getClass().getName() + ": " + message;
	}

	/** Strips {@link CompletionException} and {@link ExecutionException} wrappers that carry a cause. */
	static Throwable unwrapRequestThrowable(Throwable throwable) {
		Throwable current = throwable;
		while ((current instanceof CompletionException || current instanceof ExecutionException)
				&& current.getCause() != null) {
			current = current.getCause();
		}
		return current;
	}

	static boolean isFatalRequestThrowable(Throwable throwable) {
		return throwable instanceof VirtualMachineError;
	}

	static void throwAsUnchecked(Throwable throwable) {
		if (throwable instanceof RuntimeException) {
			throw (RuntimeException) throwable;
		}
		if (throwable instanceof Error) {
			throw (Error) throwable;
		}
		throw new IllegalStateException("Unexpected checked throwable", throwable);
	}
}
