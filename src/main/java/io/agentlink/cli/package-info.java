/**
 * picocli front end. Every subcommand prints one JSON document on stdout; remote failures are
 * printed as an error document on stderr with exit code 1.
 */
package io.agentlink.cli;
