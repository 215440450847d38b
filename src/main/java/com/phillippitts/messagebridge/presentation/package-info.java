/**
 * HTTP boundary: submission controller, bearer-key filter and exception mapping.
 */
package com.phillippitts.messagebridge.presentation;
