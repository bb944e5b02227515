package org.belief.resolution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * RISULTATO RISOLUZIONE - Contenitore immutabile per l'esito di una refutazione
 *
 * COMPONENTI:
 * • Esito: clausola vuota derivata (insieme insoddisfacibile, obiettivo implicato)
 *   oppure punto fisso raggiunto senza contraddizione
 * • Prova: sequenza ordinata di passi che termina con [] (solo per esito positivo)
 * • Statistiche: passate di saturazione, risolventi generati, clausole mantenute
 */
public final class ResolutionResult {

    //region ATTRIBUTI CORE

    private final boolean emptyClauseDerived;
    private final List<ResolutionStep> proof;
    private final int passes;
    private final int resolventsGenerated;
    private final int clausesRetained;

    //endregion

    //region COSTRUZIONE

    private ResolutionResult(boolean emptyClauseDerived, List<ResolutionStep> proof,
                             int passes, int resolventsGenerated, int clausesRetained) {
        this.emptyClauseDerived = emptyClauseDerived;
        this.proof = Collections.unmodifiableList(new ArrayList<>(proof));
        this.passes = passes;
        this.resolventsGenerated = resolventsGenerated;
        this.clausesRetained = clausesRetained;
    }

    /**
     * Esito positivo: la clausola vuota è stata derivata.
     *
     * @param proof passi di risoluzione fino a [] (vuota se [] era già in input)
     */
    static ResolutionResult refuted(List<ResolutionStep> proof, int passes,
                                    int resolventsGenerated, int clausesRetained) {
        if (proof == null) {
            throw new IllegalArgumentException("Prova di refutazione non può essere null");
        }
        return new ResolutionResult(true, proof, passes, resolventsGenerated, clausesRetained);
    }

    /**
     * Esito negativo: punto fisso raggiunto senza derivare [].
     */
    static ResolutionResult saturated(int passes, int resolventsGenerated, int clausesRetained) {
        return new ResolutionResult(false, List.of(), passes, resolventsGenerated, clausesRetained);
    }

    //endregion

    //region INTERFACCIA PUBBLICA

    /**
     * @return true se la clausola vuota è stata derivata (l'obiettivo è implicato)
     */
    public boolean isEmptyClauseDerived() {
        return emptyClauseDerived;
    }

    /**
     * Passi della dimostrazione in ordine topologico: ogni risolvente compare
     * dopo i passi che producono le sue premesse derivate.
     *
     * INVARIANTI:
     * • Lista immutabile, vuota se la clausola vuota non è stata derivata
     *   oppure se era già presente tra le premesse
     * • Se non vuota, l'ultimo passo genera la clausola vuota []
     *
     * @return passi della refutazione
     */
    public List<ResolutionStep> getProof() {
        return proof;
    }

    /**
     * @return numero di passate di saturazione eseguite (0 se l'insieme di
     *         partenza era vuoto o conteneva già la clausola vuota)
     */
    public int getPasses() {
        return passes;
    }

    /**
     * Conta tutti i risolventi calcolati, compresi quelli poi scartati come
     * tautologie, duplicati o clausole sussunte.
     *
     * @return risolventi generati
     */
    public int getResolventsGenerated() {
        return resolventsGenerated;
    }

    /**
     * @return clausole presenti nell'insieme di lavoro al termine, clausole
     *         iniziali comprese
     */
    public int getClausesRetained() {
        return clausesRetained;
    }

    /**
     * Formatta la prova, un passo per riga:
     * (clausola1) e (clausola2) genera clausola_derivata
     */
    public String formatProof() {
        if (!emptyClauseDerived) {
            return "Nessuna prova: punto fisso raggiunto senza derivare []";
        }
        if (proof.isEmpty()) {
            return "La clausola vuota [] è presente tra le premesse";
        }
        StringBuilder result = new StringBuilder();
        for (int i = 0; i < proof.size(); i++) {
            result.append(String.format("%2d. %s%n", i + 1, proof.get(i)));
        }
        return result.toString();
    }

    @Override
    public String toString() {
        return String.format("ResolutionResult{esito=%s, passate=%d, risolventi=%d, clausole=%d}",
                emptyClauseDerived ? "REFUTATO" : "SATURO", passes, resolventsGenerated, clausesRetained);
    }

    //endregion
}
