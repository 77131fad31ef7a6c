package cz.iocb.chemgraph.smiles;

import cz.iocb.chemgraph.molecule.AtomicNumbers;
import cz.iocb.chemgraph.molecule.MoleculeBuilder;



/**
 * Parser of the content of a bracket atom: isotope, symbol, chirality, hydrogens, charge and atom class.
 */
class BracketAtomParser
{
    static class BracketAtom
    {
        int isotope;
        String symbol;
        int atomicNumber;
        boolean aromatic;
        String chirality;
        int hydrogenCount;
        int charge;
        int atomClass;
    }


    private static final String[] aromaticSymbols = { "se", "as", "te", "b", "c", "n", "o", "p", "s" };

    private final String content;
    private final int offset;
    private int index = 0;


    /**
     * @param content text between the brackets
     * @param position position of the opening bracket in the whole SMILES string
     */
    private BracketAtomParser(String content, int position)
    {
        this.content = content;
        this.offset = position + 1;
    }


    static BracketAtom parse(String content, int position) throws SmilesException
    {
        return new BracketAtomParser(content, position).parse();
    }


    private BracketAtom parse() throws SmilesException
    {
        BracketAtom atom = new BracketAtom();

        if(content.isEmpty())
            throw error(ErrorKind.SYNTAX, "empty bracket atom");

        if(SmilesTokenizer.isDigit(peek()))
            atom.isotope = readNumber();

        readSymbol(atom);
        atom.chirality = readChirality();

        if(peek() == 'H')
        {
            index++;
            atom.hydrogenCount = SmilesTokenizer.isDigit(peek()) ? readNumber() : 1;
        }

        atom.charge = readCharge();

        if(peek() == ':')
        {
            index++;

            if(!SmilesTokenizer.isDigit(peek()))
                throw error(ErrorKind.SYNTAX, "atom class must be a number");

            atom.atomClass = readNumber();
        }

        if(index < content.length())
            throw error(ErrorKind.SYNTAX, "unexpected character '" + peek() + "' in bracket atom");

        return atom;
    }


    private void readSymbol(BracketAtom atom) throws SmilesException
    {
        char c = peek();

        if(c == '*')
        {
            index++;
            atom.symbol = "*";
            atom.atomicNumber = AtomicNumbers.WILDCARD;
            return;
        }

        if(Character.isLowerCase(c))
        {
            for(String symbol : aromaticSymbols)
            {
                if(content.startsWith(symbol, index))
                {
                    index += symbol.length();
                    atom.symbol = Character.toUpperCase(symbol.charAt(0)) + symbol.substring(1);
                    atom.atomicNumber = MoleculeBuilder.getAtomicNumber(atom.symbol);
                    atom.aromatic = true;
                    return;
                }
            }

            throw error(ErrorKind.UNSUPPORTED_ELEMENT, "unknown aromatic element " + c);
        }

        if(!Character.isUpperCase(c))
            throw error(ErrorKind.SYNTAX, "missing element symbol");

        String symbol = String.valueOf(c);

        if(index + 1 < content.length() && Character.isLowerCase(content.charAt(index + 1)))
        {
            String twoLetters = content.substring(index, index + 2);

            if(MoleculeBuilder.getAtomicNumber(twoLetters) > 0)
                symbol = twoLetters;
            else if(MoleculeBuilder.getAtomicNumber(symbol) <= 0)
                throw error(ErrorKind.UNSUPPORTED_ELEMENT, "unknown element " + twoLetters);
        }

        int number = MoleculeBuilder.getAtomicNumber(symbol);

        if(number <= 0)
            throw error(ErrorKind.UNSUPPORTED_ELEMENT, "unknown element " + symbol);

        index += symbol.length();
        atom.symbol = symbol;
        atom.atomicNumber = number;
    }


    private String readChirality() throws SmilesException
    {
        if(peek() != '@')
            return null;

        index++;

        if(peek() == '@')
        {
            index++;
            return "@@";
        }

        if(index + 1 < content.length())
        {
            String type = content.substring(index, index + 2);
            int limit;

            switch(type)
            {
                case "TH":
                case "AL":
                    limit = 2;
                    break;
                case "SP":
                    limit = 3;
                    break;
                case "TB":
                    limit = 20;
                    break;
                case "OH":
                    limit = 30;
                    break;
                default:
                    return "@";
            }

            index += 2;

            if(!SmilesTokenizer.isDigit(peek()))
                throw error(ErrorKind.SYNTAX, "chirality class @" + type + " needs a number");

            int start = index;
            int value = readNumber();

            if(value < 1 || value > limit)
            {
                index = start;
                throw error(ErrorKind.SYNTAX, "chirality @" + type + value + " is out of range");
            }

            return "@" + type + value;
        }

        return "@";
    }


    private int readCharge() throws SmilesException
    {
        char sign = peek();

        if(sign != '+' && sign != '-')
            return 0;

        index++;
        int value = 1;

        if(SmilesTokenizer.isDigit(peek()))
        {
            value = readNumber();
        }
        else
        {
            while(peek() == sign)
            {
                index++;
                value++;
            }
        }

        if(value > 15)
            throw error(ErrorKind.SYNTAX, "charge " + value + " is out of range");

        return sign == '+' ? value : -value;
    }


    private int readNumber() throws SmilesException
    {
        int start = index;

        while(SmilesTokenizer.isDigit(peek()))
            index++;

        if(index - start > 6)
            throw error(ErrorKind.SYNTAX, "number is too long");

        return Integer.parseInt(content.substring(start, index));
    }


    private char peek()
    {
        return index < content.length() ? content.charAt(index) : 0;
    }


    private SmilesException error(ErrorKind kind, String message)
    {
        return new SmilesException(kind, message, offset + index);
    }
}
