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
import java.util.concurrent.atomic.AtomicReference;

import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidChangeWatchedFilesParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.DocumentFormattingParams;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.modelicafmt.providers.FormattingProvider;
import com.tomaszrup.modelicafmt.util.FileContentsTracker;

/**
 * Text document and workspace services of the Modelica language server.
 *
 * <p>Delegates to:</p>
 * <ul>
 *   <li>{@link FileContentsTracker} - open document contents</li>
 *   <li>{@link FormattingHandler} - textDocument/formatting</li>
 *   <li>{@link ConfigurationChangeHandler} - workspace/didChangeConfiguration</li>
 *   <li>{@link LspRequestGuard} - fail-soft request execution</li>
 * </ul>
 */
public class ModelicaServices implements TextDocumentService, WorkspaceService, LanguageClientAware {
	private static final Logger logger = LoggerFactory.getLogger(ModelicaServices.class);

	private final FileContentsTracker fileContentsTracker = new FileContentsTracker();
	private final FormattingSettings formattingSettings;
	private final FormattingHandler formattingHandler;
	private final ConfigurationChangeHandler configChangeHandler;
	private final LspRequestGuard requestGuard = new LspRequestGuard();

	private final AtomicReference<LanguageClient> languageClient = new AtomicReference<>();

	public ModelicaServices() {
		this(new FormattingSettings());
	}

	public ModelicaServices(FormattingSettings formattingSettings) {
		this.formattingSettings = formattingSettings;
		this.formattingHandler = new FormattingHandler(new FormattingProvider(), fileContentsTracker,
				formattingSettings);
		this.configChangeHandler = new ConfigurationChangeHandler(formattingSettings);
	}

	// --- Lifecycle / wiring ---

	@Override
	public void connect(LanguageClient client) {
		this.languageClient.set(client);
	}

	public LanguageClient getLanguageClient() {
		return languageClient.get();
	}

	public FormattingSettings getFormattingSettings() {
		return formattingSettings;
	}

	public FileContentsTracker getFileContentsTracker() {
		return fileContentsTracker;
	}

	public void setSettingsChangeListener(ConfigurationChangeHandler.SettingsChangeListener listener) {
		configChangeHandler.setSettingsChangeListener(listener);
	}

	// --- TextDocumentService ---

	@Override
	public void didOpen(DidOpenTextDocumentParams params) {
		fileContentsTracker.didOpen(params);
		logger.debug("didOpen {}", params.getTextDocument().getUri());
	}

	@Override
	public void didChange(DidChangeTextDocumentParams params) {
		fileContentsTracker.didChange(params);
	}

	@Override
	public void didClose(DidCloseTextDocumentParams params) {
		fileContentsTracker.didClose(params);
		logger.debug("didClose {}", params.getTextDocument().getUri());
	}

	@Override
	public void didSave(DidSaveTextDocumentParams params) {
		// contents are kept current by didChange
	}

	@Override
	public CompletableFuture<List<? extends TextEdit>> formatting(DocumentFormattingParams params) {
		URI uri = URI.create(params.getTextDocument().getUri());
		return requestGuard.failSoftRequest("formatting", uri,
				() -> formattingHandler.formatting(params),
				Collections.emptyList());
	}

	// --- WorkspaceService ---

	@Override
	public void didChangeConfiguration(DidChangeConfigurationParams params) {
		configChangeHandler.handleConfigurationChange(params.getSettings());
	}

	@Override
	public void didChangeWatchedFiles(DidChangeWatchedFilesParams params) {
		// closed documents are read from disk on every request
	}
}
