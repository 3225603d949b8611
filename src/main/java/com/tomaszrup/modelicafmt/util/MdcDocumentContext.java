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
package com.tomaszrup.modelicafmt.util;

import java.net.URI;

import org.slf4j.MDC;

/**
 * Manages the SLF4J MDC key {@code "document"} so that every log line written
 * while a request is handled carries the name of the document it concerns.
 *
 * <pre>{@code
 * MdcDocumentContext.setDocument(uri);
 * try {
 *     // ... all log calls inside here include [Example.mo]
 * } finally {
 *     MdcDocumentContext.clear();
 * }
 * }</pre>
 */
public final class MdcDocumentContext {

	/** MDC key used in the logback pattern via {@code %X{document}}. */
	public static final String MDC_KEY = "document";

	private MdcDocumentContext() {
		// utility class
	}

	/**
	 * Sets the key to the last path segment of {@code uri}, or to the whole
	 * URI when it has no path.
	 */
	public static void setDocument(URI uri) {
		if (uri == null) {
			MDC.put(MDC_KEY, "unknown");
			return;
		}
		MDC.put(MDC_KEY, label(uri.getPath() != null ? uri.getPath() : uri.toString()));
	}

	/** Sets the key for a document known by its file path or display name. */
	public static void setDocument(String name) {
		MDC.put(MDC_KEY, name == null ? "unknown" : label(name));
	}

	public static void clear() {
		MDC.remove(MDC_KEY);
	}

	static String label(String path) {
		String normalized = path.replace('\\', '/');
		while (normalized.endsWith("/") && normalized.length() > 1) {
			normalized = normalized.substring(0, normalized.length() - 1);
		}
		int slash = normalized.lastIndexOf('/');
		return slash >= 0 && slash < normalized.length() - 1 ? normalized.substring(slash + 1) : normalized;
	}
}
