package dev.automate.backend;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PythonLiteralsTest {

    @Test
    void quotesStrings() {
        assertThat(PythonLiterals.quote("CH1:SCAle 1")).isEqualTo("\"CH1:SCAle 1\"");
        assertThat(PythonLiterals.quote("a \"b\"")).isEqualTo("'a \"b\"'");
        assertThat(PythonLiterals.quote("it's \"x\"")).isEqualTo("\"it's \\\"x\\\"\"");
        assertThat(PythonLiterals.quote("C:\\Temp")).isEqualTo("\"C:\\\\Temp\"");
    }

    @Test
    void filenamesWithVariablesBecomeFStrings() {
        assertThat(PythonLiterals.filename("run_${n}.csv")).isEqualTo("f\"run_{n}.csv\"");
        assertThat(PythonLiterals.filename("plain.csv")).isEqualTo("\"plain.csv\"");
    }

    @Test
    void derivesIdentifiers() {
        assertThat(PythonLiterals.identifier("Scope A")).isEqualTo("scope_a");
        assertThat(PythonLiterals.identifier("2nd-scope")).isEqualTo("_2nd_scope");
        assertThat(PythonLiterals.identifier(null)).isEqualTo("device");
    }

    @Test
    void formatsNumbers() {
        assertThat(PythonLiterals.number(2.0)).isEqualTo("2");
        assertThat(PythonLiterals.number(0.25)).isEqualTo("0.25");
    }
}
