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

import org.eclipse.lsp4j.*;
import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.eclipse.lsp4j.services.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.concurrent.*;
import java.util.logging.Level;

/**
 * Language server exposing the Modelica formatter through
 * {@code textDocument/formatting}.
 */
public class ModelicaLanguageServer implements LanguageServer, LanguageClientAware {

    private static final Logger logger = LoggerFactory.getLogger(ModelicaLanguageServer.class);

    static final int DEFAULT_TCP_PORT = 5007;

    /**
     * Starts the server on stdio, or on a loopback TCP socket with
     * {@code --tcp [port]}.
     */
    public static void main(String[] args) throws IOException {
        Thread.setDefaultUncaughtExceptionHandler((thread, throwable) ->
                logger.error("Uncaught exception on thread {}: {}",
                        thread.getName(), throwable.getMessage(), throwable));

        // "Unmatched cancel notification" warnings are expected for requests that already completed
        java.util.logging.Logger.getLogger("org.eclipse.lsp4j.jsonrpc.RemoteEndpoint")
                .setLevel(Level.SEVERE);
        if (args.length > 0 && "--tcp".equals(args[0])) {
            int port = DEFAULT_TCP_PORT;
            if (args.length > 1) {
                try {
                    port = Integer.parseInt(args[1]);
                } catch (NumberFormatException e) {
                    logger.error("Invalid port number: {}", args[1]);
                    System.exit(ModelicaFormatterMain.EXIT_USAGE);
                }
            }

            try (ServerSocket serverSocket = new ServerSocket(port, 50, InetAddress.getLoopbackAddress())) {
                logger.info("Modelica Language Server listening on port {} (localhost only)", port);
                try (Socket socket = serverSocket.accept()) {
                    logger.info("Client connected.");
                    startServer(socket.getInputStream(), socket.getOutputStream());
                }
            }
        } else {
            logger.info("Modelica Language Server starting in stdio mode.");
            startServer(System.in, System.out);
        }
    }

    private static void startServer(InputStream in, OutputStream out) {
        // Redirect System.out to System.err to avoid corrupting the communication channel
        System.setOut(new PrintStream(System.err));

        ModelicaLanguageServer server = new ModelicaLanguageServer();
        Launcher<LanguageClient> launcher = Launcher.createLauncher(server, LanguageClient.class, in, out);
        server.connect(launcher.getRemoteProxy());

        // block the main thread until the client disconnects
        Future<Void> future = launcher.startListening();
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Language server listener interrupted");
        } catch (ExecutionException e) {
            logger.error("Language server listener terminated with error: {}",
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage(), e);
        }
    }

    private final ModelicaServices modelicaServices;
    private volatile boolean shutdownRequested;

    public ModelicaLanguageServer() {
        this(new ModelicaServices());
    }

    public ModelicaLanguageServer(ModelicaServices modelicaServices) {
        this.modelicaServices = modelicaServices;
    }

    @Override
    public CompletableFuture<InitializeResult> initialize(InitializeParams params) {
        if (params.getClientInfo() != null) {
            logger.info("Initializing for client {} {}", params.getClientInfo().getName(),
                    params.getClientInfo().getVersion());
        }
        InitializationOptionsParser.parse(params.getInitializationOptions(),
                modelicaServices.getFormattingSettings());

        ServerCapabilities serverCapabilities = new ServerCapabilities();
        serverCapabilities.setTextDocumentSync(TextDocumentSyncKind.Incremental);
        serverCapabilities.setDocumentFormattingProvider(true);

        ServerInfo serverInfo = new ServerInfo("modelica-fmt");
        return CompletableFuture.completedFuture(new InitializeResult(serverCapabilities, serverInfo));
    }

    @Override
    public CompletableFuture<Object> shutdown() {
        shutdownRequested = true;
        logger.info("Shutdown requested");
        return CompletableFuture.completedFuture(new Object());
    }

    @Override
    public void exit() {
        System.exit(shutdownRequested ? 0 : 1);
    }

    boolean isShutdownRequested() {
        return shutdownRequested;
    }

    @Override
    public TextDocumentService getTextDocumentService() {
        return modelicaServices;
    }

    @Override
    public WorkspaceService getWorkspaceService() {
        return modelicaServices;
    }

    @Override
    public void connect(LanguageClient client) {
        modelicaServices.connect(client);
    }
}
