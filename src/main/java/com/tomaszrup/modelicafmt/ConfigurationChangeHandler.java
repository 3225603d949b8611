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

import com.google.gson.JsonObject;

/**
 * Handles didChangeConfiguration processing, keeping the {@link JsonObject}
 * dependency out of {@link ModelicaServices}.
 */
final class ConfigurationChangeHandler {

    /**
     * Callback for forwarding the raw settings object, e.g. to tests or to a
     * server that reacts to more than the formatting section.
     */
    @FunctionalInterface
    public interface SettingsChangeListener {
        void onSettingsChanged(JsonObject settings);
    }

    private final FormattingSettings formattingSettings;
    private SettingsChangeListener settingsChangeListener;

    ConfigurationChangeHandler(FormattingSettings formattingSettings) {
        this.formattingSettings = formattingSettings;
    }

    void setSettingsChangeListener(SettingsChangeListener listener) {
        this.settingsChangeListener = listener;
    }

    /**
     * Processes a didChangeConfiguration notification.
     *
     * @param rawSettings the raw settings object from the LSP params
     */
    void handleConfigurationChange(Object rawSettings) {
        if (!(rawSettings instanceof JsonObject)) {
            return;
        }
        JsonObject settings = (JsonObject) rawSettings;
        InitializationOptionsParser.applyLogLevelOption(settings);
        formattingSettings.update(settings);
        if (settingsChangeListener != null) {
            settingsChangeListener.onSettingsChanged(settings);
        }
    }
}
