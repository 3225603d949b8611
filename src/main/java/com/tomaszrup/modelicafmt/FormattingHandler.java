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
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.eclipse.lsp4j.DocumentFormattingParams;
import org.eclipse.lsp4j.TextEdit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.modelicafmt.providers.FormattingProvider;
import com.tomaszrup.modelicafmt.util.FileContentsTracker;
import com.tomaszrup.modelicafmt.util.MdcDocumentContext;

/**
 * Handles LSP document formatting requests.
 * Extracted from {@link ModelicaServices} for single-responsibility.
 */
class FormattingHandler {
	private static final Logger logger = LoggerFactory.getLogger(FormattingHandler.class);

	private final FormattingProvider formattingProvider;
	private final FileContentsTracker fileContentsTracker;
	private final FormattingSettings settings;

	FormattingHandler(FormattingProvider formattingProvider, FileContentsTracker fileContentsTracker,
			FormattingSettings settings) {
		this.formattingProvider = formattingProvider;
		this.fileContentsTracker = fileContentsTracker;
		this.settings = settings;
	}

	@SuppressWarnings("java:S1452")
	CompletableFuture<List<? extends TextEdit>> formatting(DocumentFormattingParams params) {
		if (!settings.isEnabled()) {
			return CompletableFuture.completedFuture(Collections.emptyList());
		}
		URI uri = URI.create(params.getTextDocument().getUri());
		String sourceText = fileContentsTracker.getContents(uri);
		if (sourceText == null || sourceText.isEmpty()) {
			return CompletableFuture.completedFuture(Collections.emptyList());
		}

		MdcDocumentContext.setDocument(uri);
		try {
			long start = System.nanoTime();
			List<TextEdit> edits = formattingProvider
					.provideFormatting(sourceText, uri.toString(), settings.getConfig())
					.join();
			logger.debug("formatting produced {} edit(s) in {}ms", edits.size(),
					(System.nanoTime() - start) / 1_000_000);
			return CompletableFuture.completedFuture(edits);
		} finally {
			MdcDocumentContext.clear();
		}
	}
}
