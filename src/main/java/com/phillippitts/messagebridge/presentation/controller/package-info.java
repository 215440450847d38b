/**
 * REST controllers. {@code POST /send} is the only write endpoint.
 */
package com.phillippitts.messagebridge.presentation.controller;
