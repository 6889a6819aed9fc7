package org.rewrite.optionalfeatures;

import org.rewrite.formula.Axiom;
import org.rewrite.program.AxiomDeclaration;
import org.rewrite.program.Command;
import org.rewrite.program.ProgramLoader;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * LIBRERIA ASSIOMI STANDARD - Algebra di Boole precaricabile (-std)
 *
 * Gli assiomi sono scritti nel linguaggio dei programmi e letti dal classpath:
 * associatività, commutatività, assorbimento, identità, distributività e complementi,
 * ciascuno per * e per +.
 *
 * La risorsa deve contenere solo comandi axiom: qualunque altro comando è un errore.
 */
public final class StandardAxioms {

    private static final Logger LOGGER = Logger.getLogger(StandardAxioms.class.getName());

    /** Percorso della libreria nel classpath */
    public static final String BOOLEAN_ALGEBRA_RESOURCE = "org/rewrite/optionalfeatures/boolean-algebra.eq";

    private StandardAxioms() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @return assiomi dell'algebra di Boole nell'ordine della risorsa
     * @throws IOException se la risorsa non è leggibile
     * @throws IllegalStateException se la risorsa contiene comandi diversi da axiom
     */
    public static List<Axiom> booleanAlgebra() throws IOException {
        return fromResource(BOOLEAN_ALGEBRA_RESOURCE);
    }

    /**
     * Legge una libreria di assiomi dal classpath.
     *
     * @param resourceName percorso della risorsa
     * @return assiomi dichiarati, in ordine
     */
    public static List<Axiom> fromResource(String resourceName) throws IOException {
        List<Axiom> axioms = new ArrayList<>();
        for (Command command : ProgramLoader.loadResource(resourceName)) {
            if (command.getKind() != Command.Kind.AXIOM) {
                throw new IllegalStateException("La libreria " + resourceName
                        + " contiene un comando non ammesso alla riga " + command.getLine());
            }
            axioms.add(((AxiomDeclaration) command).getAxiom());
        }
        LOGGER.info("Libreria assiomi caricata: " + resourceName + " (" + axioms.size() + " assiomi)");
        return axioms;
    }
}
