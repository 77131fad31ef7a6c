package cz.iocb.chemgraph.smiles;

import java.util.ArrayList;
import java.util.List;
import cz.iocb.chemgraph.molecule.MoleculeBuilder;



/**
 * Splits one dot-free SMILES fragment into tokens.
 */
class SmilesTokenizer
{
    private final String text;
    private final int offset;
    private int index = 0;


    /**
     * @param text fragment text
     * @param offset position of the fragment in the whole SMILES string
     */
    SmilesTokenizer(String text, int offset)
    {
        this.text = text;
        this.offset = offset;
    }


    List<Token> tokenize() throws SmilesException
    {
        List<Token> tokens = new ArrayList<Token>();

        while(index < text.length())
        {
            int start = index;
            char c = text.charAt(index);

            switch(c)
            {
                case '[':
                    int end = text.indexOf(']', index + 1);

                    if(end < 0)
                        throw new SmilesException(ErrorKind.SYNTAX, "unclosed bracket atom", offset + start);

                    tokens.add(new Token(TokenType.BRACKET_ATOM, text.substring(index + 1, end), offset + start));
                    index = end + 1;
                    break;

                case ']':
                    throw new SmilesException(ErrorKind.SYNTAX, "unexpected ']'", offset + start);

                case '(':
                    tokens.add(new Token(TokenType.BRANCH_OPEN, "(", offset + start));
                    index++;
                    break;

                case ')':
                    tokens.add(new Token(TokenType.BRANCH_CLOSE, ")", offset + start));
                    index++;
                    break;

                case '-':
                case '=':
                case '#':
                case '$':
                case ':':
                case '/':
                case '\\':
                    tokens.add(new Token(TokenType.BOND, String.valueOf(c), offset + start));
                    index++;
                    break;

                case '%':
                    if(index + 2 >= text.length() || !isDigit(text.charAt(index + 1))
                            || !isDigit(text.charAt(index + 2)))
                        throw new SmilesException(ErrorKind.SYNTAX, "'%' must be followed by two digits",
                                offset + start);

                    tokens.add(new Token(TokenType.RING_CLOSURE, text.substring(index, index + 3), offset + start));
                    index += 3;
                    break;

                default:
                    if(isDigit(c))
                    {
                        tokens.add(new Token(TokenType.RING_CLOSURE, String.valueOf(c), offset + start));
                        index++;
                    }
                    else
                    {
                        tokens.add(new Token(TokenType.ATOM, readOrganicSymbol(), offset + start));
                    }
            }
        }

        return tokens;
    }


    static boolean isDigit(char c)
    {
        return c >= '0' && c <= '9';
    }


    private String readOrganicSymbol() throws SmilesException
    {
        int start = index;
        char c = text.charAt(index);
        char next = index + 1 < text.length() ? text.charAt(index + 1) : 0;

        if(c == 'C' && next == 'l' || c == 'B' && next == 'r')
        {
            index += 2;
            return text.substring(start, index);
        }

        if("BCNOPSFI*bcnops".indexOf(c) >= 0)
        {
            if(Character.isUpperCase(c) && Character.isLowerCase(next) && "bcnops".indexOf(next) < 0
                    && MoleculeBuilder.getAtomicNumber("" + c + next) > 0)
                throw new SmilesException(ErrorKind.UNSUPPORTED_ELEMENT,
                        "element " + c + next + " must be written in brackets", offset + start);

            index++;
            return String.valueOf(c);
        }

        if(Character.isUpperCase(c))
        {
            String symbol = String.valueOf(c);

            if(Character.isLowerCase(next) && MoleculeBuilder.getAtomicNumber(symbol + next) > 0)
                symbol = symbol + next;

            if(MoleculeBuilder.getAtomicNumber(symbol) > 0)
                throw new SmilesException(ErrorKind.UNSUPPORTED_ELEMENT,
                        "element " + symbol + " must be written in brackets", offset + start);

            throw new SmilesException(ErrorKind.UNSUPPORTED_ELEMENT, "unknown element " + symbol, offset + start);
        }

        if(Character.isLowerCase(c))
            throw new SmilesException(ErrorKind.UNSUPPORTED_ELEMENT, "unknown aromatic element " + c,
                    offset + start);

        throw new SmilesException(ErrorKind.SYNTAX, "unexpected character '" + c + "'", offset + start);
    }
}
