package truthtable.cli;

/** Output formats of the command line tool. */
enum OutputFormat {
  TEXT,
  JSON
}
