package cl.leychile.structure.engine;

/**
 * Legal texts shared by the engine tests.
 */
final class SampleTexts {

    static final String LEY_20720 = String.join("\n",
            "MINISTERIO DE ECONOMÍA, FOMENTO Y TURISMO",
            "",
            "LEY NÚM. 20.720",
            "",
            "SUSTITUYE EL RÉGIMEN CONCURSAL VIGENTE POR UNA LEY DE REORGANIZACIÓN Y LIQUIDACIÓN DE EMPRESAS Y PERSONAS",
            "",
            "Santiago, 9 de enero de 2014.",
            "",
            "Teniendo presente que el H. Congreso Nacional ha dado su aprobación al siguiente",
            "",
            "Proyecto de ley:",
            "",
            "TÍTULO I",
            "Disposiciones generales",
            "",
            "Artículo 1.- Ámbito de aplicación.",
            "Esta ley regula los procedimientos concursales.",
            "",
            "Artículo 2.- Definiciones. Para efectos de esta ley se entenderá por:",
            "1) Deudor: toda persona.",
            "2) Acreedor: el titular de un crédito.",
            "",
            "TÍTULO II",
            "De la reorganización",
            "",
            "Artículo 3 bis.- Lo dispuesto en el artículo 10 de la presente ley se aplicará también.",
            "",
            "Artículo 4.- Modifícase el artículo 1545 del Código Civil.",
            "",
            "Anótese, tómese razón y publíquese.");

    static final String RESOLUCION_6597 = String.join("\n",
            "SUPERINTENDENCIA DE INSOLVENCIA Y REEMPRENDIMIENTO",
            "RESOLUCIÓN EXENTA N° 6597",
            "Santiago, 2 de diciembre de 2020",
            "MAT.: Aprueba Instructivo SUPERIR N° 4 sobre veedores.",
            "",
            "VISTOS:",
            "Lo dispuesto en la Ley N° 20.720.",
            "",
            "CONSIDERANDO:",
            "Derógase el Instructivo N° 3 de 2018.",
            "",
            "RESUELVO:",
            "I. APRUÉBASE el siguiente Instructivo:",
            "",
            "Artículo 1.- Objeto. El presente instructivo regula la designación de veedores.",
            "Artículo 2.- Vigencia. Regirá desde su publicación.",
            "",
            "ANÓTESE, COMUNÍQUESE Y ARCHÍVESE.");

    static final String INSTRUCTIVO_3_2018 = String.join("\n",
            "SUPERINTENDENCIA DE INSOLVENCIA Y REEMPRENDIMIENTO",
            "INSTRUCTIVO SUPERIR N° 3",
            "Santiago, 15 de marzo de 2018",
            "MAT.: Imparte instrucciones sobre veedores.",
            "",
            "Artículo 1.- Los veedores deberán informar mensualmente.");

    private SampleTexts() {
    }
}
